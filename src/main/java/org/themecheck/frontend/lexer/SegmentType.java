package org.themecheck.frontend.lexer;

/**
 * Top-level lexical units of a Liquid file.
 */
public enum SegmentType {
    /** Plain text or markup outside Liquid delimiters. */
    TEXT,
    /** A {@code {% ... %}} tag. */
    TAG,
    /** A {@code {{ ... }}} output. */
    OUTPUT
}
