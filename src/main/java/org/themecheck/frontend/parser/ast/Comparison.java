package org.themecheck.frontend.parser.ast;

import java.util.List;

/**
 * A binary comparison inside a condition, e.g. {@code block.id == '123'}.
 *
 * @param comparator One of {@code == != <> < > <= >= contains}.
 * @param left       The left operand.
 * @param right      The right operand.
 * @param position   The range from the start of {@code left} to the end of {@code right}.
 */
public record Comparison(String comparator, AstNode left, AstNode right, Position position) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.COMPARISON;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
