package com.growfolio.synccore.invalidation;

/*
 * 10/01/2026 - 12:49 PM
 * @author Growfolio Engineering
 */

import com.growfolio.synccore.resource.CachedResource;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * What a mutation tells the invalidation table: identifiers that key derivations read (portfolio id,
 * goal id, ...) and the cache merges the mutation wants applied together with the edges.
 */
public final class InvalidationContext {

    public static final String ID = "id";
    public static final String PARENT_ID = "parentId";
    public static final String TARGET_PARENT_ID = "targetParentId";

    private final Map<String, String> attributes;
    private final Map<CacheTarget<?>, Consumer<? extends CachedResource<?>>> merges;

    private InvalidationContext(Map<String, String> attributes,
                                Map<CacheTarget<?>, Consumer<? extends CachedResource<?>>> merges) {
        this.attributes = Collections.unmodifiableMap(attributes);
        this.merges = Collections.unmodifiableMap(merges);
    }

    public static InvalidationContext empty() {
        return builder().build();
    }

    public static InvalidationContext of(String key, String value) {
        return builder().with(key, value).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    Map<CacheTarget<?>, Consumer<? extends CachedResource<?>>> merges() {
        return merges;
    }

    @Override
    public String toString() {
        return "InvalidationContext" + attributes + (merges.isEmpty() ? "" : " merges=" + merges.keySet());
    }

    public static final class Builder {
        private final Map<String, String> attributes = new HashMap<>();
        private final Map<CacheTarget<?>, Consumer<? extends CachedResource<?>>> merges = new LinkedHashMap<>();

        public Builder with(String key, String value) {
            if (value != null) {
                attributes.put(key, value);
            }
            return this;
        }

        /**
         * Merge the mutation's result into {@code target}, in the same locked step as the edges on that store.
         */
        public <V> Builder merge(CacheTarget<V> target, Consumer<CachedResource<V>> merge) {
            merges.merge(target, merge, (first, second) -> {
                throw new IllegalStateException("Two merges declared for " + target);
            });
            return this;
        }

        public InvalidationContext build() {
            return new InvalidationContext(new HashMap<>(attributes), new LinkedHashMap<>(merges));
        }
    }
}
