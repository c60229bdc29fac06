package org.themecheck.frontend.parser.ast;

import java.util.List;

/**
 * An {@code and} / {@code or} combination. Liquid evaluates these right to left,
 * so {@code right} may itself be a logical expression.
 *
 * @param relation {@code and} or {@code or}.
 * @param left     The left operand.
 * @param right    The right operand.
 * @param position The range of both operands.
 */
public record LogicalExpression(String relation, AstNode left, AstNode right, Position position) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.LOGICAL_EXPRESSION;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
