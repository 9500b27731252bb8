package com.growfolio.synccore.cache;

/*
 * 09/29/2026 - 12:36 PM
 * @author Growfolio Engineering
 */

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Map from key to {@link CacheEntry} with freshness-aware reads.
 * <p>
 * Entries are held in a size-bounded Caffeine cache without time based expiry: stale entries stay
 * readable through {@link #getRaw(Object)} until they are replaced or invalidated. Writers take an
 * exclusive lock, readers a shared one, so a reader sees either the old or the new entry.
 * {@link #atomically(Runnable)} groups several writes into one step visible to readers.
 */
@Slf4j
public class KeyedCache<K, V> {

    private final String name;
    private final Duration defaultFreshFor;
    private final Clock clock;
    private final Cache<K, CacheEntry<V>> entries;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public KeyedCache(FreshnessPolicy policy, Clock clock, long maximumSize) {
        this.name = policy.name();
        this.defaultFreshFor = policy.freshFor();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .executor(Runnable::run)
                .build();
    }

    public String name() {
        return name;
    }

    public Duration defaultFreshFor() {
        return defaultFreshFor;
    }

    public Instant now() {
        return clock.instant();
    }

    // ==================== Reads ====================

    /**
     * Value for {@code key} if present and fresh; empty for a missing or stale entry.
     */
    public Optional<V> get(K key) {
        lock.readLock().lock();
        try {
            CacheEntry<V> entry = entries.getIfPresent(key);
            if (entry == null || entry.isStale(clock.instant())) {
                return Optional.empty();
            }
            return Optional.ofNullable(entry.value());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Entry for {@code key} regardless of staleness.
     */
    public Optional<CacheEntry<V>> getRaw(K key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.getIfPresent(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * True if an entry exists and is fresh, even when its value is {@code null}.
     */
    public boolean isFresh(K key) {
        lock.readLock().lock();
        try {
            CacheEntry<V> entry = entries.getIfPresent(key);
            return entry != null && !entry.isStale(clock.instant());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<K> keys() {
        lock.readLock().lock();
        try {
            return Set.copyOf(entries.asMap().keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public long size() {
        return entries.estimatedSize();
    }

    // ==================== Writes ====================

    public void set(K key, V value) {
        set(key, value, defaultFreshFor);
    }

    public void set(K key, V value, Duration freshFor) {
        CacheEntry<V> entry = new CacheEntry<>(value, clock.instant(), freshFor);
        lock.writeLock().lock();
        try {
            entries.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replace the value of an existing entry, fresh or stale, and restamp it as fresh.
     * Returns false and leaves the store untouched when there is no entry for {@code key}.
     */
    public boolean update(K key, UnaryOperator<V> change) {
        lock.writeLock().lock();
        try {
            CacheEntry<V> current = entries.getIfPresent(key);
            if (current == null) {
                return false;
            }
            entries.put(key, current.withValue(change.apply(current.value()), clock.instant()));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void remove(K key) {
        lock.writeLock().lock();
        try {
            entries.invalidate(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove every entry whose key matches; returns how many were removed.
     */
    public int removeAll(Predicate<? super K> matching) {
        lock.writeLock().lock();
        try {
            int before = entries.asMap().size();
            entries.asMap().keySet().removeIf(matching);
            return before - entries.asMap().size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.invalidateAll();
            log.debug("Cleared cache store {}", name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Run {@code edits} while holding the write lock, so readers observe all of them or none.
     * The lock is reentrant: the other write methods may be called from inside.
     */
    public void atomically(Runnable edits) {
        lock.writeLock().lock();
        try {
            edits.run();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
