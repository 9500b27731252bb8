package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 2:43 PM
 * @author Growfolio Engineering
 */

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Copy-on-write edits of cached lists. Cached lists are never mutated in place.
 */
final class ListMerges {

    private ListMerges() {}

    static <T> List<T> appended(List<T> list, T item) {
        List<T> copy = new ArrayList<>(list);
        copy.add(item);
        return List.copyOf(copy);
    }

    static <T> List<T> prepended(List<T> list, T item) {
        List<T> copy = new ArrayList<>(list.size() + 1);
        copy.add(item);
        copy.addAll(list);
        return List.copyOf(copy);
    }

    /**
     * Replace the element with the same id as {@code item}; the list is returned unchanged when none matches.
     */
    static <T> List<T> replaced(List<T> list, T item, Function<T, String> id) {
        String itemId = id.apply(item);
        return list.stream()
                .map(existing -> Objects.equals(id.apply(existing), itemId) ? item : existing)
                .toList();
    }

    /**
     * Replace the element with the same id, or append {@code item} when it is not there yet.
     */
    static <T> List<T> upserted(List<T> list, T item, Function<T, String> id) {
        String itemId = id.apply(item);
        boolean present = list.stream().anyMatch(existing -> Objects.equals(id.apply(existing), itemId));
        return present ? replaced(list, item, id) : appended(list, item);
    }

    static <T> List<T> removed(List<T> list, Predicate<? super T> matching) {
        return list.stream().filter(matching.negate()).toList();
    }
}
