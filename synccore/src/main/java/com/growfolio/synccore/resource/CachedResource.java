package com.growfolio.synccore.resource;

/*
 * 10/05/2026 - 12:15 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.exception.ApiExceptions.ApiException;
import com.growfolio.synccore.cache.CacheEntry;
import com.growfolio.synccore.cache.CacheKey;
import com.growfolio.synccore.cache.KeyedCache;
import com.growfolio.synccore.flight.SingleFlightCoordinator;
import com.growfolio.synccore.metrics.SyncMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Cache-aside reads over one store.
 * <p>
 * A fresh entry is returned directly. A missing or stale one is loaded through the store's
 * {@link SingleFlightCoordinator}, so concurrent misses for a key share one loader call. A failed load
 * leaves whatever entry was there untouched and rethrows to every waiter.
 * <p>
 * Every key carries a generation, advanced by each write and invalidation. A load only stores its value
 * when the generation it started under is still current, so a response fetched before a mutation never
 * overwrites the state the mutation left behind. Its own waiters still receive it.
 */
@Slf4j
public class CachedResource<V> {

    private final KeyedCache<CacheKey, V> store;
    private final SingleFlightCoordinator<CacheKey, V> flights;
    private final SyncMetrics metrics;
    private final Map<CacheKey, ApiException> refreshErrors = new ConcurrentHashMap<>();
    private final Map<CacheKey, Long> generations = new ConcurrentHashMap<>();
    private final AtomicLong epoch = new AtomicLong();

    public CachedResource(KeyedCache<CacheKey, V> store, SyncMetrics metrics) {
        this.store = store;
        this.flights = new SingleFlightCoordinator<>(store.name());
        this.metrics = metrics;
    }

    public String name() {
        return store.name();
    }

    public KeyedCache<CacheKey, V> store() {
        return store;
    }

    public SingleFlightCoordinator<CacheKey, V> flights() {
        return flights;
    }

    // ==================== Reads ====================

    public V fetch(CacheKey key, Supplier<V> loader) {
        return fetch(key, loader, value -> store.defaultFreshFor());
    }

    /**
     * @param freshness freshness window for the loaded value, for values that carry their own expiry
     */
    public V fetch(CacheKey key, Supplier<V> loader, Function<V, Duration> freshness) {
        Optional<CacheEntry<V>> cached = freshEntry(key);
        if (cached.isPresent()) {
            metrics.hit(name());
            log.debug("[{}] hit {}", name(), key);
            return cached.get().value();
        }
        metrics.miss(name());
        return flights.run(key, () -> load(key, loader, freshness, false), () -> metrics.flightJoined(name()));
    }

    /**
     * Non-blocking {@link #fetch}: a miss is loaded on {@code executor}. Cancelling the returned future
     * does not stop the load; its result still lands in the store unless the key is invalidated first.
     */
    public CompletableFuture<V> fetchAsync(CacheKey key, Supplier<V> loader, Executor executor) {
        Optional<CacheEntry<V>> cached = freshEntry(key);
        if (cached.isPresent()) {
            metrics.hit(name());
            return CompletableFuture.completedFuture(cached.get().value());
        }
        metrics.miss(name());
        Function<V, Duration> freshness = value -> store.defaultFreshFor();
        return flights.runAsync(key, () -> load(key, loader, freshness, false), executor);
    }

    /**
     * Reload regardless of freshness. When the reload fails with a retryable error and an entry exists,
     * the old value comes back marked stale together with the error; otherwise the error is thrown.
     */
    public RefreshOutcome<V> refresh(CacheKey key, Supplier<V> loader) {
        try {
            V value = flights.run(key, () -> load(key, loader, v -> store.defaultFreshFor(), true),
                    () -> metrics.flightJoined(name()));
            return RefreshOutcome.fresh(value, store.getRaw(key).map(CacheEntry::fetchedAt).orElse(store.now()));
        } catch (ApiException e) {
            Optional<CacheEntry<V>> previous = store.getRaw(key);
            if (!e.isRetryable() || previous.isEmpty()) {
                throw e;
            }
            refreshErrors.put(key, e);
            log.warn("[{}] refresh of {} failed, serving data from {}: {}",
                    name(), key, previous.get().fetchedAt(), e.getMessage());
            return RefreshOutcome.staleAfter(e, previous.get().value(), previous.get().fetchedAt());
        }
    }

    /**
     * Fresh value only; never loads.
     */
    public Optional<V> peek(CacheKey key) {
        return freshEntry(key).map(CacheEntry::value);
    }

    /**
     * Whatever the store holds for {@code key}, fresh or stale; never loads.
     */
    public Optional<V> current(CacheKey key) {
        return store.getRaw(key).map(CacheEntry::value);
    }

    public Optional<ApiException> lastRefreshError(CacheKey key) {
        return Optional.ofNullable(refreshErrors.get(key));
    }

    // ==================== Writes ====================

    public void put(CacheKey key, V value) {
        store.atomically(() -> {
            advance(key);
            store.set(key, value);
        });
    }

    /**
     * Apply {@code change} to an existing entry and mark it fresh; no-op when nothing is cached.
     */
    public boolean merge(CacheKey key, UnaryOperator<V> change) {
        AtomicBoolean merged = new AtomicBoolean();
        store.atomically(() -> {
            advance(key);
            merged.set(store.update(key, change));
        });
        return merged.get();
    }

    public void invalidate(CacheKey key) {
        store.atomically(() -> {
            advance(key);
            store.remove(key);
        });
    }

    /**
     * Remove {@code key} and every key nested under it, cached or still loading.
     */
    public int invalidateWithin(CacheKey key) {
        AtomicInteger removed = new AtomicInteger();
        store.atomically(() -> {
            Set<CacheKey> affected = new HashSet<>(store.keys());
            affected.addAll(flights.inFlightKeys());
            affected.stream().filter(candidate -> candidate.isWithin(key)).forEach(this::advance);
            removed.set(store.removeAll(candidate -> candidate.isWithin(key)));
        });
        return removed.get();
    }

    public void invalidateAll() {
        store.atomically(() -> {
            epoch.incrementAndGet();
            flights.detachAll();
            store.clear();
        });
        refreshErrors.clear();
    }

    // ==================== Internals ====================

    private Optional<CacheEntry<V>> freshEntry(CacheKey key) {
        return store.getRaw(key).filter(entry -> !entry.isStale(store.now()));
    }

    private V load(CacheKey key, Supplier<V> loader, Function<V, Duration> freshness, boolean force) {
        if (!force) {
            // an earlier flight may have stored the value between our miss and this flight starting
            Optional<CacheEntry<V>> raced = freshEntry(key);
            if (raced.isPresent()) {
                return raced.get().value();
            }
        }
        Generation generation = generationOf(key);
        long started = System.nanoTime();
        V value;
        try {
            value = loader.get();
        } catch (RuntimeException e) {
            metrics.loadFailure(name());
            if (store.getRaw(key).isPresent()) {
                log.warn("[{}] load of {} failed, keeping cached entry: {}", name(), key, e.getMessage());
            }
            throw e;
        }
        metrics.load(name(), Duration.ofNanos(System.nanoTime() - started));
        if (storeIfCurrent(key, value, freshness.apply(value), generation)) {
            refreshErrors.remove(key);
            log.debug("[{}] loaded {}", name(), key);
        } else {
            log.debug("[{}] discarded load of {}: invalidated while in flight", name(), key);
        }
        return value;
    }

    private boolean storeIfCurrent(CacheKey key, V value, Duration freshFor, Generation generation) {
        AtomicBoolean stored = new AtomicBoolean();
        store.atomically(() -> {
            if (generationOf(key).equals(generation)) {
                store.set(key, value, freshFor);
                stored.set(true);
            }
        });
        return stored.get();
    }

    /**
     * Called under the store's write lock.
     */
    private void advance(CacheKey key) {
        generations.merge(key, 1L, Long::sum);
        flights.detach(key);
    }

    private Generation generationOf(CacheKey key) {
        return new Generation(epoch.get(), generations.getOrDefault(key, 0L));
    }

    private record Generation(long epoch, long key) {}
}
