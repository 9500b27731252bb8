package com.growfolio.synccore.cache;

/*
 * 09/29/2026 - 12:32 PM
 * @author Growfolio Engineering
 */

import java.time.Duration;
import java.util.Objects;

/**
 * Freshness window of one cache store, fixed when the store is created.
 */
public record FreshnessPolicy(String name, Duration freshFor) {

    public FreshnessPolicy {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(freshFor, "freshFor");
        if (freshFor.isNegative()) {
            throw new IllegalArgumentException("freshFor must not be negative: " + freshFor);
        }
    }

    public static FreshnessPolicy of(String name, Duration freshFor) {
        return new FreshnessPolicy(name, freshFor);
    }
}
