package org.themecheck.graph;

import org.themecheck.frontend.parser.ast.Position;

/**
 * A reference found in one file, before it is bound into a graph.
 *
 * @param tagName    The construct making the reference.
 * @param targetKind The kind of the referenced module.
 * @param targetPath The referenced module path, or {@code null} if it is computed at render time.
 * @param expression The source text of the target argument.
 * @param position   Range of the target argument.
 */
record ExtractedReference(
        String tagName,
        LiquidModuleKind targetKind,
        String targetPath,
        String expression,
        Position position
) {

    boolean isDynamic() {
        return targetPath == null;
    }
}
