package org.themecheck.frontend.traversal;

import org.themecheck.frontend.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The stack of nodes enclosing the node currently being visited, outermost first.
 * Only the traversal pushes and pops; handlers get a read-only view.
 */
public final class AncestorChain {

    private final List<AstNode> nodes = new ArrayList<>();
    private final List<AstNode> view = Collections.unmodifiableList(nodes);

    void push(AstNode node) {
        nodes.add(node);
    }

    void pop() {
        nodes.remove(nodes.size() - 1);
    }

    /**
     * @return The direct parent of the current node, or empty at the document root.
     */
    public Optional<AstNode> parent() {
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(nodes.size() - 1));
    }

    /**
     * @return The enclosing nodes, outermost first. The list is a live read-only view.
     */
    public List<AstNode> asList() {
        return view;
    }

    /**
     * Returns an immutable copy for handlers that keep the chain beyond the current visit.
     */
    public List<AstNode> snapshot() {
        return List.copyOf(nodes);
    }

    public int depth() {
        return nodes.size();
    }
}
