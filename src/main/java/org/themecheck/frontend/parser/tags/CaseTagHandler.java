package org.themecheck.frontend.parser.tags;

import org.themecheck.frontend.parser.ILiquidTagHandler;
import org.themecheck.frontend.parser.LiquidParseException;
import org.themecheck.frontend.parser.MarkupParser;
import org.themecheck.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Parses {@code case expression}. The expression becomes a direct child of the {@code case} tag.
 */
public class CaseTagHandler implements ILiquidTagHandler {

    @Override
    public List<AstNode> parseMarkup(MarkupParser parser) throws LiquidParseException {
        AstNode subject = parser.parseExpression();
        parser.expectEnd();
        return List.of(subject);
    }
}
