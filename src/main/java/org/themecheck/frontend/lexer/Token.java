package org.themecheck.frontend.lexer;

import org.themecheck.frontend.parser.ast.Position;

/**
 * A markup token.
 *
 * @param type     The token type.
 * @param text     The token text; for strings the unquoted value.
 * @param position The absolute source range, quotes included for strings.
 */
public record Token(TokenType type, String text, Position position) {

    /**
     * @return true if this is an identifier spelled {@code word}.
     */
    public boolean isWord(String word) {
        return type == TokenType.IDENTIFIER && text.equals(word);
    }
}
