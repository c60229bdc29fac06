package org.themecheck.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Helpers shared by node records for assembling child lists.
 */
final class Nodes {

    private Nodes() {}

    static List<AstNode> concat(List<? extends AstNode> first, List<? extends AstNode> second) {
        List<AstNode> all = new ArrayList<>(first.size() + second.size());
        all.addAll(first);
        all.addAll(second);
        return Collections.unmodifiableList(all);
    }

    static List<AstNode> nonNull(AstNode... nodes) {
        List<AstNode> present = new ArrayList<>(nodes.length);
        for (AstNode node : nodes) {
            if (node != null) present.add(node);
        }
        return Collections.unmodifiableList(present);
    }
}
