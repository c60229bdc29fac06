package org.themecheck.frontend.parser.ast;

import java.util.List;

/**
 * Root of a parsed Liquid file.
 *
 * @param children The top-level nodes in document order.
 * @param position The range of the whole file.
 */
public record DocumentNode(List<AstNode> children, Position position) implements AstNode {

    public DocumentNode {
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DOCUMENT;
    }

    @Override
    public List<AstNode> getChildren() {
        return children;
    }
}
