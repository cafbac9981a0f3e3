package io.github.cyfko.keyflat.core.api;

import io.github.cyfko.keyflat.core.config.KeyFormat;
import io.github.cyfko.keyflat.core.exception.AmbiguousKeyFormatException;
import io.github.cyfko.keyflat.core.exception.NestingDepthExceededException;
import io.github.cyfko.keyflat.core.exception.StructuralConflictException;
import io.github.cyfko.keyflat.core.exception.UnresolvableKeyException;

import java.util.Map;

/**
 * Rebuilds a nested structure from a flat mapping produced by a {@link Flattener}.
 * <p>
 * Each flat key is split into path segments on the delimiter characters of the {@link KeyFormat}.
 * Any mixture of delimiters between two segments counts as a single split point, and the
 * {@code suffixEnd}/{@code suffixListEnd} flags play no role. Containers are created along the path
 * and the value is stored at its last segment.
 * </p>
 *
 * <pre>{@code
 * Unflattener unflattener = KeyFlat.unflattener();
 *
 * Map<String, Object> nested = unflattener.unflatten(Map.of(
 *     "geo.latitude", 12.3456,
 *     "tags[0]", "a",
 *     "tags[1]", "b"
 * ));
 * // → {geo={latitude=12.3456}, tags=[a, b]}
 * }</pre>
 *
 * <p>The same {@link KeyFormat} used to flatten must be used to unflatten. {@code unflatten} always
 * returns a map at the root; {@code restore} returns a list when the root itself was a list.</p>
 *
 * @author Frank KOSSI
 * @see Flattener
 * @since 1.0.0
 */
public interface Unflattener {

    /**
     * Rebuilds a nested structure.
     *
     * @param source flat mapping, must not be null
     * @return a new ordered nested map
     * @throws AmbiguousKeyFormatException  if the key format has no delimiter
     * @throws UnresolvableKeyException     if a key has no segment
     * @throws StructuralConflictException  if keys disagree on the structure and the policy is strict
     * @throws NestingDepthExceededException if a key has more segments than the policy allows
     */
    default Map<String, Object> unflatten(Map<String, ?> source) {
        return unflatten(source, "");
    }

    /**
     * Rebuilds a nested structure from keys carrying a start key.
     *
     * @param source   flat mapping, must not be null
     * @param startKey start key to remove from every key, {@code null} meaning none
     * @return a new ordered nested map
     * @throws AmbiguousKeyFormatException  if the key format has no delimiter
     * @throws UnresolvableKeyException     if a key has no segment
     * @throws StructuralConflictException  if keys disagree on the structure and the policy is strict
     * @throws NestingDepthExceededException if a key has more segments than the policy allows
     */
    Map<String, Object> unflatten(Map<String, ?> source, String startKey);

    /**
     * Rebuilds the nested value a flat mapping was produced from, root included: a root whose keys
     * are the list indexes {@code 0..n-1} comes back as a {@link java.util.List}.
     *
     * <pre>{@code
     * unflattener.restore(Map.of("[0]", "x", "[1][0]", 1)); // → [x, [1]]
     * }</pre>
     *
     * @param source flat mapping, must not be null
     * @return a new ordered nested map, or a list for a list root
     * @throws AmbiguousKeyFormatException  if the key format has no delimiter
     * @throws UnresolvableKeyException     if a key has no segment
     * @throws StructuralConflictException  if keys disagree on the structure and the policy is strict
     * @throws NestingDepthExceededException if a key has more segments than the policy allows
     */
    default Object restore(Map<String, ?> source) {
        return restore(source, "");
    }

    /**
     * Rebuilds the nested value, root included, from keys carrying a start key.
     *
     * @param source   flat mapping, must not be null
     * @param startKey start key to remove from every key, {@code null} meaning none
     * @return a new ordered nested map, or a list for a list root
     * @see #restore(Map)
     */
    Object restore(Map<String, ?> source, String startKey);

    KeyFormat getKeyFormat();
}
