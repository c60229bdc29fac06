package org.themecheck.frontend.parser;

import org.themecheck.frontend.parser.ast.DocumentNode;

/**
 * Turns the raw text of a Liquid file into a syntax tree.
 * The checks and the theme graph depend only on this contract.
 */
@FunctionalInterface
public interface ILiquidParser {

    /**
     * @param source The file text.
     * @return The root of the syntax tree.
     * @throws LiquidParseException if the text is not well-formed Liquid.
     */
    DocumentNode parse(String source) throws LiquidParseException;
}
