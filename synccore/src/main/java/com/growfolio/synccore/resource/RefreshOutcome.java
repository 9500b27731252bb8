package com.growfolio.synccore.resource;

/*
 * 10/05/2026 - 12:23 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.exception.ApiExceptions.ApiException;

import java.time.Instant;
import java.util.Optional;

/**
 * Result of a forced refresh: either a freshly fetched value, or the previous value kept after the
 * refresh failed together with the failure, so the caller can show the data and offer a retry.
 */
public record RefreshOutcome<V>(V value, Instant fetchedAt, boolean stale, ApiException error) {

    public static <V> RefreshOutcome<V> fresh(V value, Instant fetchedAt) {
        return new RefreshOutcome<>(value, fetchedAt, false, null);
    }

    public static <V> RefreshOutcome<V> staleAfter(ApiException error, V value, Instant fetchedAt) {
        return new RefreshOutcome<>(value, fetchedAt, true, error);
    }

    public Optional<ApiException> failure() {
        return Optional.ofNullable(error);
    }
}
