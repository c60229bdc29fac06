package org.themecheck.frontend.parser.tags;

import org.themecheck.frontend.lexer.Token;
import org.themecheck.frontend.lexer.TokenType;
import org.themecheck.frontend.parser.ILiquidTagHandler;
import org.themecheck.frontend.parser.LiquidParseException;
import org.themecheck.frontend.parser.MarkupParser;
import org.themecheck.frontend.parser.ast.AstNode;
import org.themecheck.frontend.parser.ast.NamedArgument;
import org.themecheck.frontend.parser.ast.Position;
import org.themecheck.frontend.parser.ast.RenderMarkup;

import java.util.List;

/**
 * Parses the markup of {@code render} and {@code include}.
 *
 * <p>Syntax: {@code 'snippet' [with|for expression] [as alias] [, name: value]*}
 */
public class RenderTagHandler implements ILiquidTagHandler {

    @Override
    public List<AstNode> parseMarkup(MarkupParser parser) throws LiquidParseException {
        AstNode snippet = parser.parseExpression();
        Position end = snippet.position();

        String variableKind = null;
        AstNode variable = null;
        if (parser.peek().isWord("with") || parser.peek().isWord("for")) {
            variableKind = parser.advance().text();
            variable = parser.parseExpression();
            end = variable.position();
        }

        String alias = null;
        if (parser.matchWord("as")) {
            Token aliasToken = parser.consume(TokenType.IDENTIFIER, "Expected an alias name after 'as'");
            alias = aliasToken.text();
            end = aliasToken.position();
        }

        List<NamedArgument> arguments = parser.parseNamedArguments();
        if (!arguments.isEmpty()) {
            end = arguments.get(arguments.size() - 1).position();
        }
        parser.expectEnd();

        return List.of(new RenderMarkup(snippet, variableKind, variable, alias, arguments,
                Position.spanning(snippet.position(), end)));
    }
}
