package com.growfolio.synccore.invalidation;

/*
 * 10/01/2026 - 12:59 PM
 * @author Growfolio Engineering
 */

import com.growfolio.synccore.cache.CacheKey;
import com.growfolio.synccore.resource.CachedResource;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * One row of the invalidation table: when {@code trigger} succeeds, drop entries of {@code target}
 * chosen by {@code strategy}. Applying an edge never fails; a key that is not cached is simply skipped.
 */
public record InvalidationEdge<V>(
        MutationKind trigger,
        CacheTarget<V> target,
        KeyStrategy strategy,
        Function<InvalidationContext, Optional<CacheKey>> keyDerivation) {

    public InvalidationEdge {
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(strategy, "strategy");
        if (strategy != KeyStrategy.CLEAR_COLLECTION) {
            Objects.requireNonNull(keyDerivation, "keyDerivation");
        }
    }

    public static <V> InvalidationEdge<V> clearSingleton(MutationKind trigger, CacheTarget<V> target, CacheKey key) {
        return new InvalidationEdge<>(trigger, target, KeyStrategy.CLEAR_SINGLETON, context -> Optional.of(key));
    }

    public static <V> InvalidationEdge<V> removeKey(MutationKind trigger, CacheTarget<V> target,
                                                   Function<InvalidationContext, Optional<CacheKey>> keyDerivation) {
        return new InvalidationEdge<>(trigger, target, KeyStrategy.REMOVE_KEY, keyDerivation);
    }

    public static <V> InvalidationEdge<V> clearCollection(MutationKind trigger, CacheTarget<V> target) {
        return new InvalidationEdge<>(trigger, target, KeyStrategy.CLEAR_COLLECTION, null);
    }

    void applyTo(CachedResource<V> resource, InvalidationContext context) {
        switch (strategy) {
            case CLEAR_SINGLETON -> keyDerivation.apply(context).ifPresent(resource::invalidate);
            case REMOVE_KEY -> keyDerivation.apply(context).ifPresent(resource::invalidateWithin);
            case CLEAR_COLLECTION -> resource.invalidateAll();
        }
    }
}
