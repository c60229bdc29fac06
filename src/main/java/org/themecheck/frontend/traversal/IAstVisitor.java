package org.themecheck.frontend.traversal;

import org.themecheck.frontend.parser.ast.AstNode;

/**
 * Callback invoked by {@link AstTraversal} for every node in document order.
 */
@FunctionalInterface
public interface IAstVisitor {

    /**
     * Visits one node before any of its children.
     *
     * @param node      The node being visited.
     * @param ancestors The nodes enclosing {@code node}.
     */
    void visit(AstNode node, AncestorChain ancestors);
}
