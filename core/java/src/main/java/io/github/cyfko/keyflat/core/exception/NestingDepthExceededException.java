package io.github.cyfko.keyflat.core.exception;

import io.github.cyfko.keyflat.core.config.FlatPolicy;

/**
 * Exception thrown when a structure is nested deeper than {@link FlatPolicy#maxDepth()}.
 * <p>
 * Flattening checks the container depth of the source, unflattening the number of segments of each
 * flat key. Self-referencing containers are reported through this exception as well, since their
 * walk never bottoms out.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class NestingDepthExceededException extends RuntimeException {

    private final int maxDepth;

    /**
     * @param maxDepth   the limit that was exceeded
     * @param policyName name of the policy defining the limit
     * @param location   key (or key prefix) at which the limit was hit
     */
    public NestingDepthExceededException(int maxDepth, String policyName, String location) {
        super(String.format("Nesting depth exceeds %d at '%s'. Policy applied: %s", maxDepth, location, policyName));
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
