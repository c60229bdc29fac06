package org.themecheck.checks;

import org.themecheck.frontend.parser.ast.AstNode;
import org.themecheck.frontend.parser.ast.NodeKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The handlers of all active checks for one file, keyed by node kind. Built once per file; within a kind,
 * handlers run in check registration order and then in the order each check registered them.
 */
public final class DispatchTable {

    /**
     * A handler together with the context of the check that contributed it.
     */
    public record Registration(CheckContext context, String checkCode, IAsyncNodeHandler<AstNode> handler) {}

    private final Map<NodeKind, List<Registration>> registrations = new EnumMap<>(NodeKind.class);

    /**
     * Adds every handler of one check. Call in check registration order.
     */
    public void add(String checkCode, CheckContext context, HandlerTable handlers) {
        for (NodeKind kind : NodeKind.values()) {
            for (IAsyncNodeHandler<AstNode> handler : handlers.handlersFor(kind)) {
                registrations.computeIfAbsent(kind, k -> new ArrayList<>())
                        .add(new Registration(context, checkCode, handler));
            }
        }
    }

    public List<Registration> handlersFor(NodeKind kind) {
        return registrations.getOrDefault(kind, List.of());
    }

    public boolean isEmpty() {
        return registrations.isEmpty();
    }
}
