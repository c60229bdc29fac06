package org.themecheck.frontend.parser.ast;

import java.util.HashMap;
import java.util.Map;

/**
 * The closed set of node shapes produced by the Liquid parser.
 * Check handlers are keyed by these kinds; each kind maps to exactly one node class.
 */
public enum NodeKind {
    DOCUMENT(DocumentNode.class),
    TEXT(TextNode.class),
    LIQUID_TAG(LiquidTag.class),
    LIQUID_BRANCH(LiquidBranch.class),
    LIQUID_VARIABLE_OUTPUT(LiquidVariableOutput.class),
    LIQUID_VARIABLE(LiquidVariable.class),
    LIQUID_FILTER(LiquidFilter.class),
    VARIABLE_LOOKUP(VariableLookup.class),
    STRING(StringLiteral.class),
    NUMBER(NumberLiteral.class),
    LIQUID_LITERAL(LiquidLiteral.class),
    COMPARISON(Comparison.class),
    LOGICAL_EXPRESSION(LogicalExpression.class),
    NAMED_ARGUMENT(NamedArgument.class),
    RENDER_MARKUP(RenderMarkup.class);

    private static final Map<Class<? extends AstNode>, NodeKind> BY_TYPE = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            BY_TYPE.put(kind.nodeType, kind);
        }
    }

    private final Class<? extends AstNode> nodeType;

    NodeKind(Class<? extends AstNode> nodeType) {
        this.nodeType = nodeType;
    }

    /**
     * @return The node class carrying this kind.
     */
    public Class<? extends AstNode> nodeType() {
        return nodeType;
    }

    /**
     * Resolves the kind of a concrete node class.
     *
     * @param nodeType The node class.
     * @return The matching kind.
     * @throws IllegalArgumentException if the class is not a known node shape.
     */
    public static NodeKind of(Class<? extends AstNode> nodeType) {
        NodeKind kind = BY_TYPE.get(nodeType);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown node type: " + nodeType.getName());
        }
        return kind;
    }
}
