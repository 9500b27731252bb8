package com.growfolio.synccore.invalidation;

/*
 * 10/01/2026 - 12:41 PM
 * @author Growfolio Engineering
 */

/**
 * Name of a cache store that invalidation edges and merges can address.
 * The type parameter ties the name to the value type of the store registered under it.
 */
public record CacheTarget<V>(String name) {

    public static <V> CacheTarget<V> named(String name) {
        return new CacheTarget<>(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
