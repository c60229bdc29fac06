package org.themecheck.frontend.parser.ast;

import java.util.List;

/**
 * One branch of a branching tag: the default branch directly after the opening tag
 * (name {@code null}), or an {@code elsif}, {@code when} or {@code else} branch.
 *
 * @param name        The branch tag name, or {@code null} for the default branch.
 * @param markup      The raw markup of the branch tag.
 * @param markupNodes Parsed markup expressions of the branch tag.
 * @param children    The body of the branch.
 * @param position    The range from the branch tag to the start of the next branch or end tag.
 */
public record LiquidBranch(
        String name,
        String markup,
        List<AstNode> markupNodes,
        List<AstNode> children,
        Position position
) implements AstNode {

    public LiquidBranch {
        markupNodes = List.copyOf(markupNodes);
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIQUID_BRANCH;
    }

    public boolean isDefault() {
        return name == null;
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.concat(markupNodes, children);
    }
}
