package org.themecheck.frontend.parser.tags;

import org.themecheck.frontend.parser.ILiquidTagHandler;
import org.themecheck.frontend.parser.LiquidParseException;
import org.themecheck.frontend.parser.MarkupParser;
import org.themecheck.frontend.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code content_for 'block', type: 'name', id: 'x'}: the content type followed by named arguments.
 */
public class ContentForTagHandler implements ILiquidTagHandler {

    @Override
    public List<AstNode> parseMarkup(MarkupParser parser) throws LiquidParseException {
        List<AstNode> nodes = new ArrayList<>();
        nodes.add(parser.parseExpression());
        nodes.addAll(parser.parseNamedArguments());
        parser.expectEnd();
        return nodes;
    }
}
