package com.growfolio.synccore.metrics;

/*
 * 10/02/2026 - 9:58 AM
 * @author Growfolio Engineering
 */

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Micrometer meters for the cache stores, tagged with the store name.
 */
public class SyncMetrics {

    private final MeterRegistry registry;

    public SyncMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Metrics backed by an in-memory registry, for tests and standalone use.
     */
    public static SyncMetrics inMemory() {
        return new SyncMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void hit(String cache) {
        counter("growfolio.cache.hits", "Fresh cache reads", cache).increment();
    }

    public void miss(String cache) {
        counter("growfolio.cache.misses", "Missing or stale cache reads", cache).increment();
    }

    public void load(String cache, Duration elapsed) {
        counter("growfolio.cache.loads", "Producer invocations", cache).increment();
        Timer.builder("growfolio.cache.load.duration")
                .description("Time spent in producers")
                .tag("cache", cache)
                .register(registry)
                .record(elapsed);
    }

    public void loadFailure(String cache) {
        counter("growfolio.cache.load.failures", "Failed producer invocations", cache).increment();
    }

    public void flightJoined(String cache) {
        counter("growfolio.cache.flight.joins", "Callers that attached to an in-flight load", cache).increment();
    }

    public void invalidation(String cache) {
        counter("growfolio.cache.invalidations", "Invalidation edges applied", cache).increment();
    }

    public double count(String name, String cache) {
        Counter counter = registry.find(name).tag("cache", cache).counter();
        return counter != null ? counter.count() : 0.0;
    }

    private Counter counter(String name, String description, String cache) {
        return Counter.builder(name)
                .description(description)
                .tag("cache", cache)
                .register(registry);
    }
}
