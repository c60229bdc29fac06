package org.themecheck.frontend.lexer;

import org.themecheck.frontend.parser.LiquidParseException;
import org.themecheck.frontend.parser.ast.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexes the markup of a single tag or output. Offsets are absolute within the file.
 */
public final class MarkupLexer {

    private final String source;
    private final int end;
    private int pos;

    /**
     * @param source The whole file text.
     * @param start  The absolute offset where the markup starts.
     * @param end    The absolute offset one past the end of the markup.
     */
    public MarkupLexer(String source, int start, int end) {
        this.source = source;
        this.pos = start;
        this.end = end;
    }

    /**
     * @return All tokens of the markup, terminated by an {@link TokenType#EOF} token.
     * @throws LiquidParseException on an unterminated string or an unexpected character.
     */
    public List<Token> tokenize() throws LiquidParseException {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            while (pos < end && Character.isWhitespace(source.charAt(pos))) pos++;
            if (pos >= end) {
                tokens.add(new Token(TokenType.EOF, "", new Position(end, end)));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() throws LiquidParseException {
        int start = pos;
        char c = source.charAt(pos);

        if (c == '\'' || c == '"') {
            int close = source.indexOf(c, pos + 1);
            if (close < 0 || close >= end) {
                throw new LiquidParseException("Unterminated string", new Position(start, end));
            }
            pos = close + 1;
            return new Token(TokenType.STRING, source.substring(start + 1, close), new Position(start, pos));
        }
        if (Character.isDigit(c) || (c == '-' && pos + 1 < end && Character.isDigit(source.charAt(pos + 1)))) {
            pos++;
            while (pos < end && (Character.isDigit(source.charAt(pos))
                    || (source.charAt(pos) == '.' && !startsWith("..")))) {
                pos++;
            }
            return token(TokenType.NUMBER, start);
        }
        if (Character.isLetter(c) || c == '_') {
            while (pos < end && isIdentifierPart(source.charAt(pos))) pos++;
            return token(TokenType.IDENTIFIER, start);
        }
        if (startsWith("==") || startsWith("!=") || startsWith("<>") || startsWith("<=") || startsWith(">=")) {
            pos += 2;
            return token(TokenType.COMPARATOR, start);
        }
        if (startsWith("..")) {
            pos += 2;
            return token(TokenType.DOTDOT, start);
        }
        pos++;
        return switch (c) {
            case '<', '>' -> token(TokenType.COMPARATOR, start);
            case '.' -> token(TokenType.DOT, start);
            case ',' -> token(TokenType.COMMA, start);
            case ':' -> token(TokenType.COLON, start);
            case '|' -> token(TokenType.PIPE, start);
            case '[' -> token(TokenType.LBRACKET, start);
            case ']' -> token(TokenType.RBRACKET, start);
            case '(' -> token(TokenType.LPAREN, start);
            case ')' -> token(TokenType.RPAREN, start);
            default -> throw new LiquidParseException(
                    "Unexpected character '" + c + "'", new Position(start, pos));
        };
    }

    private Token token(TokenType type, int start) {
        return new Token(type, source.substring(start, pos), new Position(start, pos));
    }

    private boolean startsWith(String text) {
        return pos + text.length() <= end && source.startsWith(text, pos);
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '?';
    }
}
