package org.themecheck.frontend.parser.ast;

import java.util.List;

/**
 * Base interface for all nodes of a parsed Liquid document.
 * Every node carries its {@link NodeKind} tag and the range of source text it covers.
 */
public interface AstNode {

    /**
     * @return The kind tag used to dispatch this node to check handlers.
     */
    NodeKind kind();

    /**
     * @return The half-open source range covered by this node.
     */
    Position position();

    /**
     * Returns the children of this node in document order.
     * Traversals rely on this order being the order in which the children appear in the source.
     *
     * @return The child nodes, never null.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }
}
