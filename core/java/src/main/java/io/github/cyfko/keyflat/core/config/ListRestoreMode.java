package io.github.cyfko.keyflat.core.config;

/**
 * Controls which container type unflattening produces for index-keyed levels.
 */
public enum ListRestoreMode {
    /** Containers whose keys are exactly {@code "0".."n-1"}, in order, become lists. */
    RESTORE_LISTS,
    /** Every container is a map; list indexes stay numeric string keys. */
    MAPS_ONLY;
}
