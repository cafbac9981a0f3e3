package io.github.cyfko.keyflat.core.exception;

/**
 * Exception thrown when a flat key yields no path segment once the start key and the
 * delimiters are removed, leaving no destination for its value.
 * <p>
 * The whole unflatten call is aborted; no partial result is returned.
 * </p>
 *
 * <pre>{@code
 * KeyFlat.unflatten(Map.of("..[]", "x"), KeyFormat.defaults());
 * // → "Flat key '..[]' does not contain any path segment"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnresolvableKeyException extends RuntimeException {

    private final String key;

    /**
     * @param key the offending flat key, as received
     */
    public UnresolvableKeyException(String key) {
        super("Flat key '" + key + "' does not contain any path segment");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
