package org.themecheck.frontend.parser.ast;

import java.util.List;

/**
 * A {@code name: value} argument of a tag or filter.
 *
 * @param name     The argument name.
 * @param value    The argument expression.
 * @param position The range from the name to the end of the value.
 */
public record NamedArgument(String name, AstNode value, Position position) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.NAMED_ARGUMENT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
