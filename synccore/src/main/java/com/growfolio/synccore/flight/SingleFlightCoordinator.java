package com.growfolio.synccore.flight;

/*
 * 09/30/2026 - 9:32 AM
 * @author Growfolio Engineering
 */

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs at most one producer per key at a time.
 * <p>
 * The first caller for a key registers a {@link PendingFetch} and invokes the producer; callers arriving
 * while it runs wait for the same outcome. Success and failure both reach every waiter. The pending fetch
 * is removed before its outcome is published, so a failure is never replayed: the next call starts over.
 * <p>
 * Waiters that give up (interrupted, or cancelling the future from {@link #runAsync}) only stop
 * observing; the shared producer keeps running for the others.
 * <p>
 * {@link #detach} forgets a running flight without stopping it: its current waiters still get its outcome,
 * later callers start a new producer.
 */
@Slf4j
public class SingleFlightCoordinator<K, V> {

    private final String name;
    private final Map<K, PendingFetch<K, V>> inFlight = new ConcurrentHashMap<>();

    public SingleFlightCoordinator(String name) {
        this.name = name;
    }

    /**
     * Run {@code producer} for {@code key} on the calling thread, or wait for the call already in flight.
     *
     * @return the producer's value
     * @throws RuntimeException the producer's own exception, rethrown to every waiter
     * @throws CancellationException if this caller was interrupted while waiting
     */
    public V run(K key, Supplier<V> producer) {
        return run(key, producer, null);
    }

    /**
     * Same as {@link #run(Object, Supplier)}; {@code onJoin} is told when the caller attached to an
     * existing flight instead of starting one.
     */
    public V run(K key, Supplier<V> producer, Runnable onJoin) {
        PendingFetch<K, V> created = new PendingFetch<>(key, new CompletableFuture<>(), Instant.now());
        PendingFetch<K, V> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            log.debug("[{}] joining in-flight fetch for {}", name, key);
            if (onJoin != null) {
                onJoin.run();
            }
            return await(existing);
        }
        execute(created, producer);
        return await(created);
    }

    /**
     * Asynchronous variant: the leader's producer runs on {@code executor}.
     * The returned future is a copy of the shared one; cancelling it leaves the shared fetch running.
     */
    public CompletableFuture<V> runAsync(K key, Supplier<V> producer, Executor executor) {
        PendingFetch<K, V> created = new PendingFetch<>(key, new CompletableFuture<>(), Instant.now());
        PendingFetch<K, V> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            log.debug("[{}] joining in-flight fetch for {}", name, key);
            return existing.sharedResult().copy();
        }
        try {
            executor.execute(() -> execute(created, producer));
        } catch (RuntimeException e) {
            inFlight.remove(key, created);
            created.sharedResult().completeExceptionally(e);
        }
        return created.sharedResult().copy();
    }

    public boolean isInFlight(K key) {
        return inFlight.containsKey(key);
    }

    public Optional<PendingFetch<K, V>> pending(K key) {
        return Optional.ofNullable(inFlight.get(key));
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public Set<K> inFlightKeys() {
        return Set.copyOf(inFlight.keySet());
    }

    /**
     * Stop offering the running flight for {@code key} to new callers.
     *
     * @return whether a flight was running
     */
    public boolean detach(K key) {
        PendingFetch<K, V> removed = inFlight.remove(key);
        if (removed != null) {
            log.debug("[{}] detached in-flight fetch for {}", name, key);
        }
        return removed != null;
    }

    public int detachMatching(Predicate<? super K> matching) {
        int detached = 0;
        for (K key : inFlightKeys()) {
            if (matching.test(key) && detach(key)) {
                detached++;
            }
        }
        return detached;
    }

    public int detachAll() {
        return detachMatching(key -> true);
    }

    /**
     * Invoke the producer and publish its outcome. Never throws: failures travel through the shared future.
     */
    private void execute(PendingFetch<K, V> pending, Supplier<V> producer) {
        V value;
        try {
            value = producer.get();
        } catch (RuntimeException | Error e) {
            inFlight.remove(pending.key(), pending);
            log.debug("[{}] fetch for {} failed: {}", name, pending.key(), e.toString());
            pending.sharedResult().completeExceptionally(e);
            return;
        }
        inFlight.remove(pending.key(), pending);
        pending.sharedResult().complete(value);
    }

    private V await(PendingFetch<K, V> pending) {
        try {
            return pending.sharedResult().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException(
                    "Stopped waiting for " + name + " fetch of " + pending.key());
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new CompletionException(cause);
    }
}
