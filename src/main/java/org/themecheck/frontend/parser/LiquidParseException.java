package org.themecheck.frontend.parser;

import org.themecheck.frontend.parser.ast.Position;

/**
 * Signals that a Liquid source could not be turned into a syntax tree.
 */
public class LiquidParseException extends Exception {

    private final Position position;

    /**
     * @param message  Human-readable description of the syntax error.
     * @param position The range of source text the error refers to.
     */
    public LiquidParseException(String message, Position position) {
        super(message);
        this.position = position;
    }

    /**
     * @return The range of source text the error refers to.
     */
    public Position getPosition() {
        return position;
    }
}
