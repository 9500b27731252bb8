package com.growfolio.dataclient.support;

import com.growfolio.dataclient.repository.InvalidationTable;
import com.growfolio.synccore.cache.CacheStoreFactory;
import com.growfolio.synccore.cache.MutableClock;
import com.growfolio.synccore.invalidation.InvalidationRules;
import com.growfolio.synccore.metrics.SyncMetrics;

import java.time.Duration;
import java.time.Instant;

/**
 * Stores and invalidation table wired the way the application wires them, over a clock tests can move.
 */
public final class SyncFixture {

    public static final Instant START = Instant.parse("2024-03-04T15:00:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final SyncMetrics metrics = SyncMetrics.inMemory();
    private final CacheStoreFactory stores = new CacheStoreFactory(clock, 100, metrics);
    private final InvalidationRules rules = InvalidationTable.rules(metrics);

    public CacheStoreFactory stores() {
        return stores;
    }

    public InvalidationRules rules() {
        return rules;
    }

    public SyncMetrics metrics() {
        return metrics;
    }

    public Instant now() {
        return clock.instant();
    }

    public void advance(Duration duration) {
        clock.advance(duration);
    }
}
