package io.github.cyfko.keyflat.core.utils;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Classification helpers for nested values.
 * <p>
 * A nested value is a container when it is a {@link List} or a {@link Map}; everything else,
 * {@code null} included, is an opaque leaf. Untyped sources (decoded JSON, form parameters, property
 * trees) sometimes represent lists as maps keyed {@code 0..n-1}; {@link #isSequentiallyKeyed(Map)}
 * recognises that shape.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ContainerUtils {

    private ContainerUtils() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    public static boolean isContainer(Object value) {
        return value instanceof List<?> || value instanceof Map<?, ?>;
    }

    /**
     * Returns whether the value is a container holding at least one entry. Empty containers are
     * stored as leaf values and never descended into.
     *
     * @param value any nested value
     * @return true for a non-empty list or map
     */
    public static boolean isNonEmptyContainer(Object value) {
        if (value instanceof List<?> list) {
            return !list.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return false;
    }

    /**
     * Decides whether a container is framed as a list.
     *
     * @param container    a list or a map
     * @param inferFromKeys whether a sequentially keyed map counts as a list
     * @return true if the container is a list, or an inferred one
     */
    public static boolean isList(Object container, boolean inferFromKeys) {
        if (container instanceof List<?>) {
            return true;
        }
        return inferFromKeys && container instanceof Map<?, ?> map && isSequentiallyKeyed(map);
    }

    /**
     * Returns whether the keys of the map are exactly {@code 0, 1, ..., n-1} in iteration order.
     * Keys may be integral numbers or their canonical decimal strings. An empty map qualifies.
     *
     * @param map the map to inspect, must not be null
     * @return true if the map is keyed like a list
     */
    public static boolean isSequentiallyKeyed(Map<?, ?> map) {
        int expected = 0;
        for (Object key : map.keySet()) {
            if (!isIndex(key, expected++)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Iterates the entries of a list or map as (key, value) pairs, list positions being their keys.
     *
     * @param container a list or a map
     * @param visitor   receives each rendered key with its value
     */
    public static void forEachEntry(Object container, EntryVisitor visitor) {
        if (container instanceof List<?> list) {
            int index = 0;
            for (Iterator<?> it = list.iterator(); it.hasNext(); index++) {
                visitor.visit(Integer.toString(index), it.next());
            }
        } else if (container instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                visitor.visit(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
    }

    private static boolean isIndex(Object key, int expected) {
        if (key instanceof Integer || key instanceof Long || key instanceof Short || key instanceof Byte) {
            return ((Number) key).longValue() == expected;
        }
        return key instanceof String text && text.equals(Integer.toString(expected));
    }

    /**
     * Receives container entries from {@link #forEachEntry(Object, EntryVisitor)}.
     */
    @FunctionalInterface
    public interface EntryVisitor {
        void visit(String key, Object value);
    }
}
