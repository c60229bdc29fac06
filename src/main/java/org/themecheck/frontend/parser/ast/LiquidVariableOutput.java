package org.themecheck.frontend.parser.ast;

import java.util.List;

/**
 * A {@code {{ expression | filter }}} output.
 *
 * @param markup   The raw markup between the delimiters.
 * @param variable The parsed expression with its filters, or {@code null} for an empty output.
 * @param position The range including the delimiters.
 */
public record LiquidVariableOutput(String markup, LiquidVariable variable, Position position) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.LIQUID_VARIABLE_OUTPUT;
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.nonNull(variable);
    }
}
