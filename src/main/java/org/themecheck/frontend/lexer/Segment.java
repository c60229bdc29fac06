package org.themecheck.frontend.lexer;

import org.themecheck.frontend.parser.ast.Position;

/**
 * One top-level lexical unit of a Liquid file.
 *
 * @param type        The segment type.
 * @param position    The range of the whole segment, delimiters included.
 * @param name        The tag name for {@link SegmentType#TAG}, otherwise {@code null}.
 * @param markup      The trimmed markup after the tag name, the trimmed output body, or the raw text.
 * @param markupStart The absolute offset at which {@code markup} begins.
 */
public record Segment(SegmentType type, Position position, String name, String markup, int markupStart) {

    /**
     * @return The absolute offset one past the end of {@code markup}.
     */
    public int markupEnd() {
        return markupStart + markup.length();
    }
}
