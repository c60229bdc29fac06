package org.themecheck.frontend.parser.ast;

/**
 * Half-open offset range {@code [start, end)} into the raw text of one file.
 *
 * @param start The offset of the first character covered by the range.
 * @param end   The offset one past the last character covered by the range.
 */
public record Position(int start, int end) {

    public Position {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid position [" + start + ", " + end + ")");
        }
    }

    /**
     * @return The number of characters covered by this range.
     */
    public int length() {
        return end - start;
    }

    /**
     * Checks whether this range lies within a text of the given length.
     *
     * @param textLength The length of the file text.
     * @return true if both bounds are inside {@code [0, textLength]}.
     */
    public boolean isWithin(int textLength) {
        return end <= textLength;
    }

    /**
     * Returns the range spanning from the start of {@code first} to the end of {@code last}.
     */
    public static Position spanning(Position first, Position last) {
        return new Position(first.start(), last.end());
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
