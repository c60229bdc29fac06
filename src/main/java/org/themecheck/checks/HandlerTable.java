package org.themecheck.checks;

import org.themecheck.frontend.parser.ast.AstNode;
import org.themecheck.frontend.parser.ast.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The handlers one check contributes for one file, keyed by node kind.
 * Handlers registered for the same kind run in registration order.
 */
public final class HandlerTable {

    private static final HandlerTable EMPTY = new HandlerTable(new EnumMap<>(NodeKind.class));

    private final Map<NodeKind, List<IAsyncNodeHandler<AstNode>>> handlers;

    private HandlerTable(Map<NodeKind, List<IAsyncNodeHandler<AstNode>>> handlers) {
        this.handlers = handlers;
    }

    public static HandlerTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param kind A node kind.
     * @return The handlers for that kind, possibly empty.
     */
    public List<IAsyncNodeHandler<AstNode>> handlersFor(NodeKind kind) {
        return handlers.getOrDefault(kind, List.of());
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    public static final class Builder {
        private final Map<NodeKind, List<IAsyncNodeHandler<AstNode>>> handlers = new EnumMap<>(NodeKind.class);

        /**
         * Registers a synchronous handler for the kind of {@code nodeType}.
         */
        public <N extends AstNode> Builder on(Class<N> nodeType, INodeHandler<? super N> handler) {
            return onAsync(nodeType, (node, ancestors) -> {
                handler.handle(node, ancestors);
                return CompletableFuture.completedFuture(null);
            });
        }

        /**
         * Registers an asynchronous handler for the kind of {@code nodeType}.
         */
        public <N extends AstNode> Builder onAsync(Class<N> nodeType, IAsyncNodeHandler<? super N> handler) {
            NodeKind kind = NodeKind.of(nodeType);
            IAsyncNodeHandler<AstNode> erased = (node, ancestors) -> handler.handle(nodeType.cast(node), ancestors);
            handlers.computeIfAbsent(kind, k -> new ArrayList<>()).add(erased);
            return this;
        }

        public HandlerTable build() {
            Map<NodeKind, List<IAsyncNodeHandler<AstNode>>> copy = new EnumMap<>(NodeKind.class);
            handlers.forEach((kind, list) -> copy.put(kind, Collections.unmodifiableList(new ArrayList<>(list))));
            return new HandlerTable(copy);
        }
    }
}
