package org.themecheck.frontend.parser.ast;

/**
 * A quoted string, or the name part of a dotted lookup.
 *
 * @param value        The unquoted value.
 * @param singleQuoted Whether the literal used single quotes.
 * @param position     The range of the literal, including quotes when present.
 */
public record StringLiteral(String value, boolean singleQuoted, Position position) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.STRING;
    }
}
