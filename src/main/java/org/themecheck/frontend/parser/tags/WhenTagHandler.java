package org.themecheck.frontend.parser.tags;

import org.themecheck.frontend.lexer.TokenType;
import org.themecheck.frontend.parser.ILiquidTagHandler;
import org.themecheck.frontend.parser.LiquidParseException;
import org.themecheck.frontend.parser.MarkupParser;
import org.themecheck.frontend.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code when a, b or c}: a list of values separated by commas or {@code or}.
 */
public class WhenTagHandler implements ILiquidTagHandler {

    @Override
    public List<AstNode> parseMarkup(MarkupParser parser) throws LiquidParseException {
        List<AstNode> values = new ArrayList<>();
        do {
            values.add(parser.parseExpression());
        } while (parser.match(TokenType.COMMA) || parser.matchWord("or"));
        parser.expectEnd();
        return values;
    }
}
