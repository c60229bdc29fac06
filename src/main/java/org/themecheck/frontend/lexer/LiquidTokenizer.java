package org.themecheck.frontend.lexer;

import org.themecheck.frontend.parser.LiquidParseException;
import org.themecheck.frontend.parser.ast.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a Liquid file into text, tag and output segments.
 *
 * <p>The bodies of opaque tags ({@code raw}, {@code comment}, {@code schema}, ...) are emitted as a single
 * text segment followed by the closing tag, without looking for delimiters inside them.</p>
 */
public final class LiquidTokenizer {

    /** Tags whose body is not Liquid. */
    public static final Set<String> OPAQUE_TAGS = Set.of(
            "raw", "comment", "doc", "schema", "javascript", "style", "stylesheet");

    private final String source;
    private final List<Segment> segments = new ArrayList<>();

    public LiquidTokenizer(String source) {
        this.source = source;
    }

    /**
     * Tokenizes the whole source.
     *
     * @return The segments in document order.
     * @throws LiquidParseException if a delimiter or opaque tag is never closed.
     */
    public List<Segment> tokenize() throws LiquidParseException {
        int pos = 0;
        int length = source.length();
        while (pos < length) {
            int tagStart = source.indexOf("{%", pos);
            int outputStart = source.indexOf("{{", pos);
            int next = firstOf(tagStart, outputStart);
            if (next < 0) {
                addText(pos, length);
                break;
            }
            addText(pos, next);
            if (next == tagStart) {
                pos = readTag(next);
            } else {
                pos = readOutput(next);
            }
        }
        return segments;
    }

    private int readTag(int start) throws LiquidParseException {
        int close = source.indexOf("%}", start + 2);
        if (close < 0) {
            throw new LiquidParseException("Tag '{%' was never closed", new Position(start, source.length()));
        }
        int end = close + 2;
        Segment tag = tagSegment(start, end, start + 2, close);
        segments.add(tag);

        if (OPAQUE_TAGS.contains(tag.name())) {
            Pattern endTag = Pattern.compile("\\{%-?\\s*end" + tag.name() + "\\s*-?%}");
            Matcher matcher = endTag.matcher(source);
            if (!matcher.find(end)) {
                throw new LiquidParseException(
                        "Unclosed tag '" + tag.name() + "'", tag.position());
            }
            addText(end, matcher.start());
            segments.add(tagSegment(matcher.start(), matcher.end(), matcher.start() + 2, matcher.end() - 2));
            return matcher.end();
        }
        return end;
    }

    /**
     * Splits the markup of a {@code {% liquid %}} tag into one tag segment per non-empty line.
     * Offsets stay absolute. Lines starting with {@code #} are comments and are dropped, as are the lines
     * between an opaque tag and its {@code end} tag.
     *
     * @param tag A tag segment of this tokenizer's source named {@code liquid}.
     * @return The tag segments in source order.
     */
    public List<Segment> tokenizeLiquidTag(Segment tag) {
        List<Segment> lines = new ArrayList<>();
        String opaque = null;
        int lineStart = tag.markupStart();
        int markupEnd = tag.markupEnd();
        while (lineStart < markupEnd) {
            int newline = source.indexOf('\n', lineStart);
            int lineEnd = newline < 0 || newline > markupEnd ? markupEnd : newline;
            int start = skipWhitespace(lineStart, lineEnd);
            int end = trimEnd(start, lineEnd);
            lineStart = lineEnd + 1;
            if (start == end || source.charAt(start) == '#') continue;

            Segment line = lineSegment(start, end);
            if (opaque != null) {
                if (!line.name().equals("end" + opaque)) continue;
                opaque = null;
            } else if (OPAQUE_TAGS.contains(line.name())) {
                opaque = line.name();
            }
            lines.add(line);
        }
        return lines;
    }

    private Segment lineSegment(int start, int end) {
        int nameEnd = start;
        while (nameEnd < end && !Character.isWhitespace(source.charAt(nameEnd))) {
            nameEnd++;
        }
        int markupStart = skipWhitespace(nameEnd, end);
        return new Segment(SegmentType.TAG, new Position(start, end),
                source.substring(start, nameEnd), source.substring(markupStart, end), markupStart);
    }

    private int readOutput(int start) throws LiquidParseException {
        int close = source.indexOf("}}", start + 2);
        if (close < 0) {
            throw new LiquidParseException("Output '{{' was never closed", new Position(start, source.length()));
        }
        int innerStart = skipTrimMarker(start + 2, close);
        int innerEnd = skipTrimMarkerBackwards(innerStart, close);
        int markupStart = skipWhitespace(innerStart, innerEnd);
        int markupEnd = trimEnd(markupStart, innerEnd);
        segments.add(new Segment(SegmentType.OUTPUT, new Position(start, close + 2), null,
                source.substring(markupStart, markupEnd), markupStart));
        return close + 2;
    }

    private Segment tagSegment(int start, int end, int innerStart, int innerEnd) {
        innerStart = skipTrimMarker(innerStart, innerEnd);
        innerEnd = skipTrimMarkerBackwards(innerStart, innerEnd);
        int nameStart = skipWhitespace(innerStart, innerEnd);
        int nameEnd = nameStart;
        if (nameEnd < innerEnd && source.charAt(nameEnd) == '#') {
            nameEnd++;
        } else {
            while (nameEnd < innerEnd && !Character.isWhitespace(source.charAt(nameEnd))) {
                nameEnd++;
            }
        }
        int markupStart = skipWhitespace(nameEnd, innerEnd);
        int markupEnd = trimEnd(markupStart, innerEnd);
        return new Segment(SegmentType.TAG, new Position(start, end),
                source.substring(nameStart, nameEnd), source.substring(markupStart, markupEnd), markupStart);
    }

    private void addText(int start, int end) {
        if (end > start) {
            segments.add(new Segment(SegmentType.TEXT, new Position(start, end), null,
                    source.substring(start, end), start));
        }
    }

    private int skipTrimMarker(int from, int limit) {
        return from < limit && source.charAt(from) == '-' ? from + 1 : from;
    }

    private int skipTrimMarkerBackwards(int floor, int to) {
        return to > floor && source.charAt(to - 1) == '-' ? to - 1 : to;
    }

    private int skipWhitespace(int from, int limit) {
        while (from < limit && Character.isWhitespace(source.charAt(from))) from++;
        return from;
    }

    private int trimEnd(int floor, int to) {
        while (to > floor && Character.isWhitespace(source.charAt(to - 1))) to--;
        return to;
    }

    private static int firstOf(int a, int b) {
        if (a < 0) return b;
        if (b < 0) return a;
        return Math.min(a, b);
    }
}
