package org.themecheck.graph;

/**
 * Outcome of reading a module during the graph build.
 */
public enum ParseStatus {
    /** The module was read and its references extracted, or it is an asset that is never parsed. */
    OK,
    /** The module could not be parsed; it has no outgoing references. */
    UNPARSABLE
}
