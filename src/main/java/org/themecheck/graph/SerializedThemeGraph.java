package org.themecheck.graph;

import java.util.List;

/**
 * Flat form of a {@link ThemeGraph}: nodes in module insertion order, edges in bind order.
 */
public record SerializedThemeGraph(List<Node> nodes, List<Edge> edges) {

    public SerializedThemeGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /**
     * @param id   The module path.
     * @param kind The module kind in lower case, e.g. {@code snippet}.
     */
    public record Node(String id, String kind) {}

    public record Edge(String source, String target) {}
}
