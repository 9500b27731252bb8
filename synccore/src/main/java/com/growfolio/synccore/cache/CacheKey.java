package com.growfolio.synccore.cache;

/*
 * 09/29/2026 - 12:15 PM
 * @author Growfolio Engineering
 */

import java.util.Objects;

/**
 * Identifies one cached item inside a store.
 * <p>
 * Three shapes are used: a singleton marker ({@code singleton("balance")}), a scoped key
 * ({@code of("holdings", portfolioId)}) and a nested key ({@code of("holdings", portfolioId, holdingId)}).
 * A nested key {@linkplain #isWithin(CacheKey) belongs to} the scoped key with the same scope and parent.
 */
public record CacheKey(String scope, String parentId, String childId) {

    public CacheKey {
        Objects.requireNonNull(scope, "scope");
        if (childId != null && parentId == null) {
            throw new IllegalArgumentException("childId requires a parentId");
        }
    }

    public static CacheKey singleton(String scope) {
        return new CacheKey(scope, null, null);
    }

    public static CacheKey of(String scope, String parentId) {
        return new CacheKey(scope, Objects.requireNonNull(parentId, "parentId"), null);
    }

    public static CacheKey of(String scope, String parentId, String childId) {
        return new CacheKey(scope, Objects.requireNonNull(parentId, "parentId"), Objects.requireNonNull(childId, "childId"));
    }

    public boolean isSingleton() {
        return parentId == null;
    }

    /**
     * True if this key equals {@code other} or is nested below it.
     */
    public boolean isWithin(CacheKey other) {
        if (equals(other)) {
            return true;
        }
        if (!scope.equals(other.scope)) {
            return false;
        }
        if (other.parentId == null) {
            return true;
        }
        return other.childId == null && other.parentId.equals(parentId);
    }

    @Override
    public String toString() {
        if (parentId == null) {
            return scope;
        }
        return childId == null ? scope + ":" + parentId : scope + ":" + parentId + ":" + childId;
    }
}
