package org.themecheck.frontend.parser.ast;

import java.util.List;

/**
 * A variable reference with its property lookups. {@code block.id} has name {@code block} and a single
 * {@link StringLiteral} lookup {@code id}; {@code block[key]} has a lookup of the {@code key} expression.
 *
 * @param name     The root variable name, or {@code null} for a bare bracket lookup such as {@code ['x']}.
 * @param lookups  Property lookups in source order.
 * @param position The range of the whole reference.
 */
public record VariableLookup(String name, List<AstNode> lookups, Position position) implements AstNode {

    public VariableLookup {
        lookups = List.copyOf(lookups);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VARIABLE_LOOKUP;
    }

    @Override
    public List<AstNode> getChildren() {
        return lookups;
    }
}
