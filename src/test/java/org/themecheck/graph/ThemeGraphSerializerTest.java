package org.themecheck.graph;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.themecheck.graph.ThemeModules.sectionModule;
import static org.themecheck.graph.ThemeModules.snippetModule;
import static org.themecheck.graph.ThemeModules.templateModule;

public class ThemeGraphSerializerTest {

    private static ThemeGraph sampleGraph() {
        ThemeGraph graph = new ThemeGraph("/theme");
        ThemeModule template = templateModule(graph, "templates/index.liquid");
        ThemeModule section1 = sectionModule(graph, "section1");
        ThemeModule section2 = sectionModule(graph, "section2");
        ThemeModule snippet1 = snippetModule(graph, "snippet1");
        ThemeModule snippet2 = snippetModule(graph, "snippet2");
        graph.bind(template, section1);
        graph.bind(template, section2);
        graph.bind(section1, snippet1);
        graph.bind(section1, snippet2);
        return graph;
    }

    @Test
    @Tag("unit")
    void serializesNodesInInsertionOrderAndEdgesInBindOrder() {
        SerializedThemeGraph serialized = ThemeGraphSerializer.serialize(sampleGraph());

        assertThat(serialized.nodes()).containsExactly(
                new SerializedThemeGraph.Node("templates/index.liquid", "template"),
                new SerializedThemeGraph.Node("sections/section1.liquid", "section"),
                new SerializedThemeGraph.Node("sections/section2.liquid", "section"),
                new SerializedThemeGraph.Node("snippets/snippet1.liquid", "snippet"),
                new SerializedThemeGraph.Node("snippets/snippet2.liquid", "snippet"));
        assertThat(serialized.edges()).containsExactly(
                new SerializedThemeGraph.Edge("templates/index.liquid", "sections/section1.liquid"),
                new SerializedThemeGraph.Edge("templates/index.liquid", "sections/section2.liquid"),
                new SerializedThemeGraph.Edge("sections/section1.liquid", "snippets/snippet1.liquid"),
                new SerializedThemeGraph.Edge("sections/section1.liquid", "snippets/snippet2.liquid"));
    }

    @Test
    @Tag("unit")
    void writesJsonWithNodesAndEdges() {
        JsonObject json = JsonParser.parseString(ThemeGraphSerializer.toJson(sampleGraph())).getAsJsonObject();

        assertThat(json.getAsJsonArray("nodes")).hasSize(5);
        assertThat(json.getAsJsonArray("edges")).hasSize(4);
        JsonObject firstNode = json.getAsJsonArray("nodes").get(0).getAsJsonObject();
        assertThat(firstNode.get("id").getAsString()).isEqualTo("templates/index.liquid");
        assertThat(firstNode.get("kind").getAsString()).isEqualTo("template");
        JsonObject lastEdge = json.getAsJsonArray("edges").get(3).getAsJsonObject();
        assertThat(lastEdge.get("source").getAsString()).isEqualTo("sections/section1.liquid");
        assertThat(lastEdge.get("target").getAsString()).isEqualTo("snippets/snippet2.liquid");
    }
}
