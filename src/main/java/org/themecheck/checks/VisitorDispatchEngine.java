package org.themecheck.checks;

import org.themecheck.frontend.parser.ast.AstNode;
import org.themecheck.frontend.traversal.AncestorChain;
import org.themecheck.frontend.traversal.AstTraversal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Walks one file's syntax tree in document pre-order and invokes the handlers registered for each node's
 * kind. All handlers of a node complete before its children are visited. A failing handler is turned into an
 * internal-error offense of its check; the traversal and all other handlers continue.
 */
public final class VisitorDispatchEngine {

    private static final Logger log = LoggerFactory.getLogger(VisitorDispatchEngine.class);

    /**
     * @param root  The root of the file's syntax tree.
     * @param table The handlers of the active checks for this file.
     */
    public void dispatch(AstNode root, DispatchTable table) {
        if (table.isEmpty()) {
            return;
        }
        AstTraversal.walk(root, (node, ancestors) -> {
            for (DispatchTable.Registration registration : table.handlersFor(node.kind())) {
                invoke(registration, node, ancestors);
            }
        });
    }

    private void invoke(DispatchTable.Registration registration, AstNode node, AncestorChain ancestors) {
        CompletionStage<Void> stage;
        try {
            stage = registration.handler().handle(node, ancestors);
        } catch (CancellationException e) {
            throw e;
        } catch (Throwable t) {
            fail(registration, node, t);
            return;
        }
        if (stage == null) {
            return;
        }
        // A cancelled stage is a failure of that handler only.
        try {
            stage.toCompletableFuture().join();
        } catch (CompletionException e) {
            fail(registration, node, e.getCause() != null ? e.getCause() : e);
        } catch (Throwable t) {
            fail(registration, node, t);
        }
    }

    private void fail(DispatchTable.Registration registration, AstNode node, Throwable error) {
        log.warn("Check {} failed on {} at {} in {}", registration.checkCode(), node.kind(), node.position(),
                registration.context().fileUri(), error);
        registration.context().reportInternalError(node.position(), error);
    }
}
