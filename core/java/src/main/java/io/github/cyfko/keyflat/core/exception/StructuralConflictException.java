package io.github.cyfko.keyflat.core.exception;

import io.github.cyfko.keyflat.core.config.ConflictPolicy;

import java.util.List;

/**
 * Exception thrown in {@link ConflictPolicy#STRICT} mode when two flat keys disagree on whether a
 * path location holds a container or a leaf value.
 * <p>
 * Two situations are reported:
 * </p>
 * <ul>
 *   <li>a key needs to descend through a location that already holds a leaf value
 *       ({@code "a" = 1} followed by {@code "a.b" = 2})</li>
 *   <li>a key assigns a leaf value where earlier keys already built a container
 *       ({@code "a.b" = 2} followed by {@code "a" = 1})</li>
 * </ul>
 *
 * <pre>{@code
 * try {
 *     Map<String, Object> nested = unflattener.unflatten(flat);
 * } catch (StructuralConflictException e) {
 *     logger.warning("Rejected flat input at " + e.getPath() + ": " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class StructuralConflictException extends RuntimeException {

    private final String key;
    private final List<String> path;

    /**
     * @param message description of the conflict
     * @param key     the flat key being processed when the conflict was detected
     * @param path    the segments leading to the conflicting location, inclusive
     */
    public StructuralConflictException(String message, String key, List<String> path) {
        super(message);
        this.key = key;
        this.path = List.copyOf(path);
    }

    public String getKey() {
        return key;
    }

    public List<String> getPath() {
        return path;
    }
}
