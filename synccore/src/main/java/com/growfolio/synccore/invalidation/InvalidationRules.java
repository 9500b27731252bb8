package com.growfolio.synccore.invalidation;

/*
 * 10/01/2026 - 1:06 PM
 * @author Growfolio Engineering
 */

import com.growfolio.synccore.metrics.SyncMetrics;
import com.growfolio.synccore.resource.CachedResource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Table of invalidation edges keyed by mutation kind, applied after every successful write.
 * <p>
 * Stores take part by {@linkplain #register registering} under a {@link CacheTarget}. For each store a
 * mutation touches, the mutation's merge (if any) and all of its edges run inside one
 * {@link com.growfolio.synccore.cache.KeyedCache#atomically(Runnable)} call. Targets nobody registered
 * are skipped. Applying the same mutation twice leaves the stores as applying it once.
 */
@Slf4j
public class InvalidationRules {

    private final Map<MutationKind, List<InvalidationEdge<?>>> table;
    private final Map<CacheTarget<?>, CachedResource<?>> registry = new ConcurrentHashMap<>();
    private final SyncMetrics metrics;

    private InvalidationRules(Map<MutationKind, List<InvalidationEdge<?>>> table, SyncMetrics metrics) {
        this.table = table;
        this.metrics = metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Attach a store to a target name. A target has exactly one owner.
     */
    public <V> void register(CacheTarget<V> target, CachedResource<V> resource) {
        CachedResource<?> previous = registry.putIfAbsent(target, resource);
        if (previous != null && previous != resource) {
            throw new IllegalStateException("Cache target already registered: " + target);
        }
    }

    public List<InvalidationEdge<?>> edgesFor(MutationKind kind) {
        return table.getOrDefault(kind, List.of());
    }

    public Set<MutationKind> mutationKinds() {
        return table.keySet();
    }

    public Collection<CacheTarget<?>> registeredTargets() {
        return List.copyOf(registry.keySet());
    }

    /**
     * Apply the merges in {@code context} and the edges declared for {@code kind}.
     */
    public void apply(MutationKind kind, InvalidationContext context) {
        List<InvalidationEdge<?>> edges = edgesFor(kind);
        Map<CacheTarget<?>, List<InvalidationEdge<?>>> byTarget = new LinkedHashMap<>();
        Set<CacheTarget<?>> targets = new LinkedHashSet<>(context.merges().keySet());
        for (InvalidationEdge<?> edge : edges) {
            targets.add(edge.target());
            byTarget.computeIfAbsent(edge.target(), t -> new ArrayList<>()).add(edge);
        }
        for (CacheTarget<?> target : targets) {
            CachedResource<?> resource = registry.get(target);
            if (resource == null) {
                log.debug("{}.{}: no store registered for {}", kind.domain(), kind.name(), target);
                continue;
            }
            applyToTarget(resource, context.merges().get(target), byTarget.getOrDefault(target, List.of()), context);
        }
        log.debug("{}.{} applied to {} with {}", kind.domain(), kind.name(), targets, context);
    }

    /**
     * Drop every registered store, e.g. on sign-out.
     */
    public void clearAll() {
        registry.values().forEach(CachedResource::invalidateAll);
        log.info("Cleared {} cache stores", registry.size());
    }

    @SuppressWarnings("unchecked")
    private <V> void applyToTarget(CachedResource<?> untyped, Consumer<? extends CachedResource<?>> untypedMerge,
                                   List<InvalidationEdge<?>> edges, InvalidationContext context) {
        CachedResource<V> resource = (CachedResource<V>) untyped;
        Consumer<CachedResource<V>> merge = (Consumer<CachedResource<V>>) untypedMerge;
        resource.store().atomically(() -> {
            if (merge != null) {
                merge.accept(resource);
            }
            for (InvalidationEdge<?> edge : edges) {
                ((InvalidationEdge<V>) edge).applyTo(resource, context);
                metrics.invalidation(resource.name());
            }
        });
    }

    public static final class Builder {
        private final Map<MutationKind, List<InvalidationEdge<?>>> table = new LinkedHashMap<>();
        private SyncMetrics metrics;

        /**
         * Declare all edges of one mutation kind. Each kind is declared once.
         */
        public Builder on(MutationKind kind, InvalidationEdge<?>... edges) {
            if (table.containsKey(kind)) {
                throw new IllegalStateException("Edges already declared for " + kind.domain() + "." + kind.name());
            }
            for (InvalidationEdge<?> edge : edges) {
                if (edge.trigger() != kind) {
                    throw new IllegalArgumentException("Edge for " + edge.trigger().name() + " declared under " + kind.name());
                }
            }
            table.put(kind, List.of(edges));
            return this;
        }

        public Builder metrics(SyncMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public InvalidationRules build() {
            return new InvalidationRules(Map.copyOf(table), metrics != null ? metrics : SyncMetrics.inMemory());
        }
    }
}
