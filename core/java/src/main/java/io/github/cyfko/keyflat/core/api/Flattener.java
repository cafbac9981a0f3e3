package io.github.cyfko.keyflat.core.api;

import io.github.cyfko.keyflat.core.config.KeyFormat;
import io.github.cyfko.keyflat.core.exception.NestingDepthExceededException;

import java.util.Map;

/**
 * Turns a nested structure of {@link java.util.Map}s and {@link java.util.List}s into a single-level
 * mapping whose keys encode the nesting path.
 * <p>
 * The walk is depth-first and pre-order. Each leaf value, and each empty container, produces one
 * entry; non-empty containers are descended into. Keys are built according to the {@link KeyFormat}
 * of the implementation:
 * </p>
 *
 * <pre>{@code
 * Flattener flattener = KeyFlat.flattener();
 *
 * Map<String, Object> flat = flattener.flatten(Map.of(
 *     "name", "A name",
 *     "geo", Map.of("latitude", 12.3456),
 *     "tags", List.of("a", "b")
 * ));
 * // → {name=A name, geo.latitude=12.3456, tags[0]=a, tags[1]=b}
 *
 * // Below a start key
 * KeyFlat.flattener(KeyFormat.path()).flatten(Map.of("id", 1), "https://example.com/");
 * // → {https://example.com/id/=1}
 * }</pre>
 *
 * <p>Entries of the returned mapping are in traversal order. A source that is not a container yields
 * an empty mapping.</p>
 *
 * @see Unflattener
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Flattener {

    /**
     * Flattens a nested structure.
     *
     * @param source a list or map, possibly nested
     * @return a new ordered flat mapping
     * @throws NestingDepthExceededException if the source is nested deeper than the policy allows
     */
    default Map<String, Object> flatten(Object source) {
        return flatten(source, "");
    }

    /**
     * Flattens a nested structure, prepending {@code startKey} to every key.
     *
     * @param source   a list or map, possibly nested
     * @param startKey literal written at the start of every key, {@code null} meaning none
     * @return a new ordered flat mapping
     * @throws NestingDepthExceededException if the source is nested deeper than the policy allows
     */
    Map<String, Object> flatten(Object source, String startKey);

    /**
     * Flattens a nested structure into an existing destination. Entries already present stay, unless
     * a generated key replaces them.
     *
     * @param source      a list or map, possibly nested
     * @param destination receives the flat entries, must not be null
     * @param startKey    literal written at the start of every key, {@code null} meaning none
     * @throws NestingDepthExceededException if the source is nested deeper than the policy allows
     */
    void flattenInto(Object source, Map<String, Object> destination, String startKey);

    KeyFormat getKeyFormat();
}
