package org.themecheck.frontend.parser.ast;

import java.util.List;

/**
 * An expression followed by zero or more filters, as found in outputs and {@code echo}.
 *
 * @param expression The filtered expression.
 * @param filters    The filters in application order.
 * @param position   The range from the expression to the end of the last filter.
 */
public record LiquidVariable(AstNode expression, List<LiquidFilter> filters, Position position) implements AstNode {

    public LiquidVariable {
        filters = List.copyOf(filters);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIQUID_VARIABLE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.concat(List.of(expression), filters);
    }
}
