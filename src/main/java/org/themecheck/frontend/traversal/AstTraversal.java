package org.themecheck.frontend.traversal;

import org.themecheck.frontend.parser.ast.AstNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Pre-order, document-order traversal of a syntax tree. The visitor returns before the node is
 * pushed onto the ancestor chain and its children are visited.
 *
 * <p>The walk keeps its own frame stack, so nesting depth is bounded by heap, not by the thread stack.</p>
 */
public final class AstTraversal {

    private AstTraversal() {}

    /**
     * Walks {@code root} and all its descendants.
     *
     * @param root    The node to start from.
     * @param visitor The callback for each node.
     */
    public static void walk(AstNode root, IAstVisitor visitor) {
        AncestorChain ancestors = new AncestorChain();
        Deque<Iterator<AstNode>> frames = new ArrayDeque<>();

        visitor.visit(root, ancestors);
        ancestors.push(root);
        frames.push(root.getChildren().iterator());

        while (!frames.isEmpty()) {
            Iterator<AstNode> children = frames.peek();
            if (!children.hasNext()) {
                frames.pop();
                ancestors.pop();
                continue;
            }
            AstNode child = children.next();
            visitor.visit(child, ancestors);
            ancestors.push(child);
            frames.push(child.getChildren().iterator());
        }
    }
}
