package com.growfolio.synccore.flight;

/*
 * 09/30/2026 - 9:24 AM
 * @author Growfolio Engineering
 */

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * An in-flight producer call that later callers for the same key attach to.
 * Dropped from the coordinator before its result is published.
 */
public record PendingFetch<K, V>(K key, CompletableFuture<V> sharedResult, Instant startedAt) {
}
