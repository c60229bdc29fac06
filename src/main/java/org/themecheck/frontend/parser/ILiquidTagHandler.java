package org.themecheck.frontend.parser;

import org.themecheck.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Parses the markup of one tag (or branch tag) into expression nodes.
 */
public interface ILiquidTagHandler {

    /**
     * @param parser The parser positioned at the start of the tag's markup.
     * @return The markup nodes in source order.
     * @throws LiquidParseException if the markup is malformed.
     */
    List<AstNode> parseMarkup(MarkupParser parser) throws LiquidParseException;
}
