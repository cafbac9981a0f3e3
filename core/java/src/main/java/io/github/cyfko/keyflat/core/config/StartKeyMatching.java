package io.github.cyfko.keyflat.core.config;

/**
 * How a start key is removed from flat keys before they are split into segments.
 */
public enum StartKeyMatching {
    /** Strip every leading character that occurs anywhere in the start key. */
    CHARACTER_SET,
    /** Strip the start key only when the flat key begins with it, verbatim. */
    LITERAL_PREFIX;
}
