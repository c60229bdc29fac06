package org.themecheck.frontend.parser.tags;

import org.themecheck.frontend.parser.ILiquidTagHandler;
import org.themecheck.frontend.parser.LiquidParseException;
import org.themecheck.frontend.parser.MarkupParser;
import org.themecheck.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Parses the condition of {@code if}, {@code elsif} and {@code unless}.
 */
public class ConditionTagHandler implements ILiquidTagHandler {

    @Override
    public List<AstNode> parseMarkup(MarkupParser parser) throws LiquidParseException {
        AstNode condition = parser.parseCondition();
        parser.expectEnd();
        return List.of(condition);
    }
}
