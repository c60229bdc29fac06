package org.themecheck.frontend.parser.ast;

/**
 * @param value    The number as written.
 * @param position The range of the literal.
 */
public record NumberLiteral(String value, Position position) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.NUMBER;
    }
}
