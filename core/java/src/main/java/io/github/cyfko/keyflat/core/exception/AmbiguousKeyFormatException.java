package io.github.cyfko.keyflat.core.exception;

import io.github.cyfko.keyflat.core.config.KeyFormat;

/**
 * Exception thrown when a {@link KeyFormat} offers no delimiter to split flat keys on.
 * <p>
 * Unflattening needs at least one of {@code suffix}, {@code prefix}, {@code prefixList} or
 * {@code suffixList} to be non-empty. Flattening never raises this exception since it only
 * concatenates literals.
 * </p>
 *
 * <pre>{@code
 * KeyFormat format = new KeyFormat("", "", false, "", "", true);
 * KeyFlat.unflatten(Map.of("ab", 1), format);
 * // → "Key format has no delimiter: suffix, prefix, prefix-list and suffix-list are all empty"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see KeyFormat#splitter()
 */
public class AmbiguousKeyFormatException extends RuntimeException {

    /**
     * @param message the message describing the cause of the exception
     */
    public AmbiguousKeyFormatException(String message) {
        super(message);
    }
}
