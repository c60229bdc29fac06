package org.themecheck.checks;

import org.themecheck.frontend.parser.ast.AstNode;
import org.themecheck.frontend.traversal.AncestorChain;

/**
 * Synchronous handler for one node kind.
 *
 * @param <N> The node class the handler is registered for.
 */
@FunctionalInterface
public interface INodeHandler<N extends AstNode> {

    /**
     * @param node      The visited node.
     * @param ancestors The enclosing nodes, read-only.
     * @throws Exception any failure; it is isolated to this handler and node.
     */
    void handle(N node, AncestorChain ancestors) throws Exception;
}
