package org.themecheck.graph;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.List;

/**
 * Converts a {@link ThemeGraph} to its flat form and to JSON.
 */
public final class ThemeGraphSerializer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private ThemeGraphSerializer() {}

    public static SerializedThemeGraph serialize(ThemeGraph graph) {
        List<SerializedThemeGraph.Node> nodes = graph.modules().values().stream()
                .map(module -> new SerializedThemeGraph.Node(module.path(), module.kind().toString()))
                .toList();
        List<SerializedThemeGraph.Edge> edges = graph.edges().stream()
                .map(edge -> new SerializedThemeGraph.Edge(edge.source(), edge.target()))
                .toList();
        return new SerializedThemeGraph(nodes, edges);
    }

    /**
     * @return The serialized graph as a JSON object with {@code nodes} and {@code edges} arrays.
     */
    public static String toJson(ThemeGraph graph) {
        return GSON.toJson(serialize(graph));
    }
}
