package com.openstable.sync.merge;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Pure functions that maintain a keyed, ordered cache of entities.
 * Inputs are never modified; every call returns a new list.
 * Order is preserved: entities keep their position when replaced, new keys are appended.
 */
public final class CacheMerge {

    private CacheMerge() {
    }

    /**
     * Upserts {@code incoming} into {@code existing}. On key collision the incoming value wins
     * in place. Applying the same batch twice yields the same list.
     */
    public static <T, K> List<T> mergeData(List<T> existing, Collection<? extends T> incoming,
                                           Function<? super T, K> key) {
        Map<K, T> byKey = new LinkedHashMap<>();
        for (T item : existing) {
            byKey.put(key.apply(item), item);
        }
        for (T item : incoming) {
            byKey.put(key.apply(item), item);
        }
        return List.copyOf(byKey.values());
    }

    public static <T, K> List<T> removeData(List<T> existing, Collection<? extends K> keysToRemove,
                                            Function<? super T, K> key) {
        Set<K> removed = new HashSet<>(keysToRemove);
        return existing.stream()
                .filter(item -> !removed.contains(key.apply(item)))
                .toList();
    }

    /**
     * Replaces the entity with the given key by {@code patch} applied to it. No match leaves the content unchanged.
     */
    public static <T, K> List<T> updateData(List<T> existing, K id, UnaryOperator<T> patch,
                                            Function<? super T, K> key) {
        List<T> result = new ArrayList<>(existing.size());
        for (T item : existing) {
            result.add(Objects.equals(key.apply(item), id) ? patch.apply(item) : item);
        }
        return Collections.unmodifiableList(result);
    }

    public static <T, K> Optional<T> findByKey(List<T> data, K id, Function<? super T, K> key) {
        return data.stream().filter(item -> Objects.equals(key.apply(item), id)).findFirst();
    }

    /**
     * Stable sort on a timestamp; entities without a timestamp go last.
     */
    public static <T> List<T> sortByTimestamp(List<T> data, Function<? super T, ? extends Instant> field,
                                              boolean ascending) {
        Comparator<Instant> order = ascending ? Comparator.naturalOrder() : Comparator.reverseOrder();
        List<T> sorted = new ArrayList<>(data);
        sorted.sort(Comparator.comparing(field, Comparator.nullsLast(order)));
        return Collections.unmodifiableList(sorted);
    }

    /**
     * Case-insensitive substring search over the given fields. A blank term returns everything.
     */
    @SafeVarargs
    public static <T> List<T> filterBySearch(List<T> data, String term, Function<? super T, ?>... fields) {
        if (term == null || term.isBlank()) {
            return List.copyOf(data);
        }
        String needle = term.toLowerCase(Locale.ROOT);
        return data.stream()
                .filter(item -> {
                    for (Function<? super T, ?> field : fields) {
                        Object value = field.apply(item);
                        if (value != null && String.valueOf(value).toLowerCase(Locale.ROOT).contains(needle)) {
                            return true;
                        }
                    }
                    return false;
                })
                .toList();
    }

    /**
     * Groups by the string form of a field, keeping first-seen group order.
     */
    public static <T> Map<String, List<T>> groupBy(List<T> data, Function<? super T, ?> field) {
        Map<String, List<T>> groups = new LinkedHashMap<>();
        for (T item : data) {
            groups.computeIfAbsent(String.valueOf(field.apply(item)), k -> new ArrayList<>()).add(item);
        }
        Map<String, List<T>> result = new LinkedHashMap<>();
        groups.forEach((k, v) -> result.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(result);
    }

    /**
     * One-based pagination. Pages outside the range return an empty item list.
     */
    public static <T> Page<T> paginate(List<T> data, int page, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        int totalItems = data.size();
        int totalPages = (totalItems + pageSize - 1) / pageSize;
        List<T> items;
        if (page < 1 || page > totalPages) {
            items = List.of();
        } else {
            int from = (page - 1) * pageSize;
            items = List.copyOf(data.subList(from, Math.min(from + pageSize, totalItems)));
        }
        return new Page<>(items, page, totalPages, totalItems, page < totalPages, page > 1);
    }
}
