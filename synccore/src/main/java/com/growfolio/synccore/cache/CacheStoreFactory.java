package com.growfolio.synccore.cache;

/*
 * 09/29/2026 - 12:25 PM
 * @author Growfolio Engineering
 */

import com.growfolio.synccore.metrics.SyncMetrics;
import com.growfolio.synccore.resource.CachedResource;

import java.time.Clock;

/**
 * Creates cache stores that share one clock, one size bound and one metrics sink.
 * Each call returns a new, independent store; nothing is shared between the stores it creates.
 */
public class CacheStoreFactory {

    public static final long DEFAULT_MAXIMUM_SIZE = 1_000;

    private final Clock clock;
    private final long maximumSize;
    private final SyncMetrics metrics;

    public CacheStoreFactory(Clock clock, long maximumSize, SyncMetrics metrics) {
        this.clock = clock;
        this.maximumSize = maximumSize > 0 ? maximumSize : DEFAULT_MAXIMUM_SIZE;
        this.metrics = metrics;
    }

    public <K, V> KeyedCache<K, V> newStore(FreshnessPolicy policy) {
        return new KeyedCache<>(policy, clock, maximumSize);
    }

    /**
     * A store plus its own single-flight coordinator, keyed by {@link CacheKey}.
     */
    public <V> CachedResource<V> newResource(FreshnessPolicy policy) {
        return new CachedResource<>(newStore(policy), metrics);
    }

    public Clock clock() {
        return clock;
    }
}
