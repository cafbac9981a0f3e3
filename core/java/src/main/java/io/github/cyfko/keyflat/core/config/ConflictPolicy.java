package io.github.cyfko.keyflat.core.config;

/**
 * Policies for flat keys that disagree on whether a path location is a container or a leaf.
 */
public enum ConflictPolicy {
    /** Replace the existing location with what the current key needs. Later keys win. */
    OVERWRITE,
    /** Throw a StructuralConflictException. */
    STRICT;
}
