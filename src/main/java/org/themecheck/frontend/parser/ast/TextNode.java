package org.themecheck.frontend.parser.ast;

/**
 * Raw markup or text between Liquid constructs, including the bodies of opaque tags such as {@code raw}.
 *
 * @param value    The verbatim text.
 * @param position The source range of the text.
 */
public record TextNode(String value, Position position) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.TEXT;
    }
}
