package org.themecheck.frontend.parser.tags;

import org.themecheck.frontend.parser.ILiquidTagHandler;
import org.themecheck.frontend.parser.LiquidParseException;
import org.themecheck.frontend.parser.MarkupParser;
import org.themecheck.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Parses {@code echo expression | filters}.
 */
public class EchoTagHandler implements ILiquidTagHandler {

    @Override
    public List<AstNode> parseMarkup(MarkupParser parser) throws LiquidParseException {
        AstNode variable = parser.parseVariable();
        parser.expectEnd();
        return List.of(variable);
    }
}
