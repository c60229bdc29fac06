package org.themecheck.checks;

import org.themecheck.frontend.parser.ast.AstNode;
import org.themecheck.frontend.traversal.AncestorChain;

import java.util.concurrent.CompletionStage;

/**
 * Handler for one node kind that completes asynchronously, e.g. after a cross-file lookup.
 * The dispatch engine waits for the returned stage before descending into the node's children.
 *
 * @param <N> The node class the handler is registered for.
 */
@FunctionalInterface
public interface IAsyncNodeHandler<N extends AstNode> {

    /**
     * @param node      The visited node.
     * @param ancestors The enclosing nodes. Only valid until the returned stage completes.
     * @return A stage completing when the handler is done; a failed stage counts as a handler failure.
     * @throws Exception any synchronous failure.
     */
    CompletionStage<Void> handle(N node, AncestorChain ancestors) throws Exception;
}
