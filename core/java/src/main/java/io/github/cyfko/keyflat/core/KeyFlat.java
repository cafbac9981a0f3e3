package io.github.cyfko.keyflat.core;

import io.github.cyfko.keyflat.core.api.Flattener;
import io.github.cyfko.keyflat.core.api.Unflattener;
import io.github.cyfko.keyflat.core.config.FlatPolicy;
import io.github.cyfko.keyflat.core.config.KeyFormat;
import io.github.cyfko.keyflat.core.exception.AmbiguousKeyFormatException;
import io.github.cyfko.keyflat.core.exception.NestingDepthExceededException;
import io.github.cyfko.keyflat.core.exception.StructuralConflictException;
import io.github.cyfko.keyflat.core.exception.UnresolvableKeyException;
import io.github.cyfko.keyflat.core.impl.BasicFlattener;
import io.github.cyfko.keyflat.core.impl.BasicUnflattener;

import java.util.Map;

/**
 * Entry point for flattening nested structures into formatted flat keys and back.
 * <p>
 * A {@link Flattener} and an {@link Unflattener} built from the same {@link KeyFormat} are inverse
 * operations for any structure whose keys do not contain the format's delimiter characters.
 * </p>
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * Map<String, Object> config = new LinkedHashMap<>();
 * config.put("id", 12345);
 * config.put("properties", Map.of("geo", Map.of("latitude", 12.3456)));
 * config.put("collections", List.of(List.of(true, false), List.of("a", "b")));
 *
 * // 1. Flatten with the default format
 * Map<String, Object> flat = KeyFlat.flattener().flatten(config);
 * // → {id=12345, properties.geo.latitude=12.3456,
 * //    collections[0][0]=true, collections[0][1]=false, collections[1][0]=a, collections[1][1]=b}
 *
 * // 2. Rebuild, with the same format
 * Map<String, Object> nested = KeyFlat.unflattener().unflatten(flat);
 * // → deep-equal to config
 *
 * // 3. Custom format and policy
 * Flattener braces = KeyFlat.flattener(KeyFormat.braces());
 * Unflattener strict = KeyFlat.unflattener(KeyFormat.braces(), FlatPolicy.strict());
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link AmbiguousKeyFormatException} - Unflattening with a format that has no delimiter</li>
 *   <li>{@link UnresolvableKeyException} - Flat key without any segment</li>
 *   <li>{@link StructuralConflictException} - Conflicting keys under a strict policy</li>
 *   <li>{@link NestingDepthExceededException} - Structure deeper than the policy allows</li>
 * </ul>
 *
 * <p>Returned flatteners and unflatteners are immutable and can be shared across threads.</p>
 *
 * @author Frank KOSSI
 * @see Flattener
 * @see Unflattener
 * @since 1.0.0
 */
public final class KeyFlat {

    private KeyFlat() {}

    public static Flattener flattener() {
        return new BasicFlattener(KeyFormat.defaults(), FlatPolicy.defaults());
    }

    public static Flattener flattener(KeyFormat keyFormat) {
        return new BasicFlattener(keyFormat, FlatPolicy.defaults());
    }

    /**
     * Creates a {@link Flattener} with the given format and policy.
     *
     * @param keyFormat  key rendering settings. Must not be null.
     * @param flatPolicy depth limit and list inference settings. Must not be null.
     * @return a new flattener
     * @throws NullPointerException if any argument is null
     */
    public static Flattener flattener(KeyFormat keyFormat, FlatPolicy flatPolicy) {
        return new BasicFlattener(keyFormat, flatPolicy);
    }

    public static Unflattener unflattener() {
        return new BasicUnflattener(KeyFormat.defaults(), FlatPolicy.defaults());
    }

    public static Unflattener unflattener(KeyFormat keyFormat) {
        return new BasicUnflattener(keyFormat, FlatPolicy.defaults());
    }

    /**
     * Creates an {@link Unflattener} with the given format and policy.
     *
     * @param keyFormat  key rendering settings, the same used to flatten. Must not be null.
     * @param flatPolicy depth limit, conflict handling, list restoration and start key settings. Must not be null.
     * @return a new unflattener
     * @throws NullPointerException if any argument is null
     */
    public static Unflattener unflattener(KeyFormat keyFormat, FlatPolicy flatPolicy) {
        return new BasicUnflattener(keyFormat, flatPolicy);
    }

    /**
     * One-shot flattening with the default policy.
     *
     * @param source    a list or map, possibly nested
     * @param keyFormat key rendering settings
     * @return a new ordered flat mapping
     */
    public static Map<String, Object> flatten(Object source, KeyFormat keyFormat) {
        return flattener(keyFormat).flatten(source);
    }

    /**
     * One-shot unflattening with the default policy, inverse of {@link #flatten(Object, KeyFormat)}.
     * A flattened root list comes back as a list.
     *
     * @param source    flat mapping
     * @param keyFormat key rendering settings, the same used to flatten
     * @return a new ordered nested map, or a list for a list root
     */
    public static Object unflatten(Map<String, ?> source, KeyFormat keyFormat) {
        return unflattener(keyFormat).restore(source);
    }
}
