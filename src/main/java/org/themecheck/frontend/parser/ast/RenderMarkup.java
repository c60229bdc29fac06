package org.themecheck.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Markup of {@code render} and {@code include}:
 * {@code 'snippet' [with|for expression] [as alias] [, name: value]*}.
 *
 * @param snippet      The target expression; a {@link StringLiteral} for static references.
 * @param variableKind {@code with} or {@code for}, or {@code null} when absent.
 * @param variable     The expression passed by {@code with}/{@code for}, or {@code null}.
 * @param alias        The {@code as} alias, or {@code null}.
 * @param arguments    Named arguments in source order.
 * @param position     The range of the whole markup.
 */
public record RenderMarkup(
        AstNode snippet,
        String variableKind,
        AstNode variable,
        String alias,
        List<NamedArgument> arguments,
        Position position
) implements AstNode {

    public RenderMarkup {
        arguments = List.copyOf(arguments);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RENDER_MARKUP;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(Nodes.nonNull(snippet, variable));
        children.addAll(arguments);
        return List.copyOf(children);
    }
}
