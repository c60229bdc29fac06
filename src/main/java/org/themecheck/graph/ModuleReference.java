package org.themecheck.graph;

import org.themecheck.frontend.parser.ast.Position;

/**
 * A static reference from one module to another.
 *
 * @param source   Path of the referencing module.
 * @param target   Path of the referenced module.
 * @param position Range of the target argument in the source file.
 * @param tagName  The construct making the reference, e.g. {@code render}.
 */
public record ModuleReference(String source, String target, Position position, String tagName) {
}
