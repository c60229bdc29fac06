package org.themecheck.frontend.parser.tags;

import org.themecheck.frontend.parser.ILiquidTagHandler;
import org.themecheck.frontend.parser.LiquidParseException;
import org.themecheck.frontend.parser.MarkupParser;
import org.themecheck.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Parses tags taking exactly one expression: {@code section}, {@code sections}, {@code layout}.
 */
public class SingleArgumentTagHandler implements ILiquidTagHandler {

    @Override
    public List<AstNode> parseMarkup(MarkupParser parser) throws LiquidParseException {
        AstNode argument = parser.parseExpression();
        parser.expectEnd();
        return List.of(argument);
    }
}
