package dev.careerpath.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Null-tolerant immutable copies that keep iteration order.
 */
public final class Frozen {

    private Frozen() {
    }

    public static <T> List<T> list(List<T> source) {
        return source == null ? List.of() : List.copyOf(source);
    }

    public static <T> Set<T> set(Iterable<T> source) {
        if (source == null) {
            return Set.of();
        }
        Set<T> copy = new LinkedHashSet<>();
        source.forEach(copy::add);
        return Collections.unmodifiableSet(copy);
    }

    public static <K, V> Map<K, V> map(Map<K, V> source) {
        if (source == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
