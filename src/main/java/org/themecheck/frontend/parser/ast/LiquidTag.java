package org.themecheck.frontend.parser.ast;

import java.util.List;

/**
 * A {@code {% name markup %}} tag. Block tags span through their matching {@code end} tag and own
 * their body; tags with branches ({@code if}, {@code unless}, {@code case}, {@code for}) own
 * {@link LiquidBranch} children instead, the first of which is the unnamed default branch.
 *
 * @param name               The tag name, e.g. {@code if} or {@code render}.
 * @param markup             The raw markup following the name.
 * @param markupNodes        Parsed markup expressions; empty for tags whose markup is not parsed.
 * @param children           Body nodes or branches.
 * @param position           The range from the opening delimiter to the end of the closing tag.
 * @param blockStartPosition The range of the opening tag alone.
 */
public record LiquidTag(
        String name,
        String markup,
        List<AstNode> markupNodes,
        List<AstNode> children,
        Position position,
        Position blockStartPosition
) implements AstNode {

    public LiquidTag {
        markupNodes = List.copyOf(markupNodes);
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIQUID_TAG;
    }

    /**
     * @return true if this tag was closed by an {@code end} tag.
     */
    public boolean isBlock() {
        return !position.equals(blockStartPosition);
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.concat(markupNodes, children);
    }
}
