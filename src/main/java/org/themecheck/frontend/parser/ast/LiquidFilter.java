package org.themecheck.frontend.parser.ast;

import java.util.List;

/**
 * A filter application such as {@code | asset_url} or {@code | default: 'x', allow_false: true}.
 *
 * @param name      The filter name.
 * @param arguments Positional expressions and {@link NamedArgument}s in source order.
 * @param position  The range from the filter name to the end of its last argument.
 */
public record LiquidFilter(String name, List<AstNode> arguments, Position position) implements AstNode {

    public LiquidFilter {
        arguments = List.copyOf(arguments);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIQUID_FILTER;
    }

    @Override
    public List<AstNode> getChildren() {
        return arguments;
    }
}
