package org.themecheck.graph;

import org.themecheck.frontend.parser.ast.Position;

/**
 * A reference whose target is computed at render time, e.g. {@code {% render snippet_name %}}.
 * No edge is created for it.
 *
 * @param source     Path of the referencing module.
 * @param tagName    The construct making the reference.
 * @param expression The source text of the target argument.
 * @param position   Range of the target argument in the source file.
 */
public record UnresolvedReference(String source, String tagName, String expression, Position position) {
}
