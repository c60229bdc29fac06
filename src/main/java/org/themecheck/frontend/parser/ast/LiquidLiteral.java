package org.themecheck.frontend.parser.ast;

import java.util.Set;

/**
 * One of the keywords {@code true}, {@code false}, {@code nil}, {@code null}, {@code empty}, {@code blank}.
 *
 * @param keyword  The keyword as written.
 * @param position The range of the keyword.
 */
public record LiquidLiteral(String keyword, Position position) implements AstNode {

    public static final Set<String> KEYWORDS = Set.of("true", "false", "nil", "null", "empty", "blank");

    @Override
    public NodeKind kind() {
        return NodeKind.LIQUID_LITERAL;
    }
}
