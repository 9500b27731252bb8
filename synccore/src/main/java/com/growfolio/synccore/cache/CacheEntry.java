package com.growfolio.synccore.cache;

/*
 * 09/29/2026 - 12:07 PM
 * @author Growfolio Engineering
 */

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Cached value with the time it was fetched and how long it stays fresh.
 * Immutable; a newer value replaces the whole entry.
 */
public record CacheEntry<V>(V value, Instant fetchedAt, Duration freshFor) {

    public CacheEntry {
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        Objects.requireNonNull(freshFor, "freshFor");
    }

    /**
     * Stale once strictly more than {@code freshFor} has elapsed since the fetch.
     */
    public boolean isStale(Instant now) {
        return age(now).compareTo(freshFor) > 0;
    }

    public Duration age(Instant now) {
        return Duration.between(fetchedAt, now);
    }

    public CacheEntry<V> withValue(V newValue, Instant now) {
        return new CacheEntry<>(newValue, now, freshFor);
    }
}
