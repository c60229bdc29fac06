package org.themecheck.graph;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.themecheck.graph.ThemeModules.assetModule;
import static org.themecheck.graph.ThemeModules.blockModule;
import static org.themecheck.graph.ThemeModules.layoutModule;
import static org.themecheck.graph.ThemeModules.sectionModule;
import static org.themecheck.graph.ThemeModules.snippetModule;
import static org.themecheck.graph.ThemeModules.templateModule;

public class ThemeGraphTest {

    @Test
    @Tag("unit")
    void bindIsIdempotentAndSymmetric() {
        ThemeGraph graph = new ThemeGraph("/theme");
        ThemeModule template = templateModule(graph, "templates/index.liquid");
        ThemeModule section = sectionModule(graph, "main");

        assertThat(graph.bind(template, section)).isTrue();
        assertThat(graph.bind(template, section)).isFalse();

        assertThat(template.dependencies()).containsExactly("sections/main.liquid");
        assertThat(section.dependents()).containsExactly("templates/index.liquid");
        assertThat(graph.edges()).containsExactly(new ThemeGraph.Edge("templates/index.liquid", "sections/main.liquid"));
    }

    @Test
    @Tag("unit")
    void factoriesBuildPathsFromNames() {
        ThemeGraph graph = new ThemeGraph("/theme");

        assertThat(templateModule(graph, "templates/index.liquid").path()).isEqualTo("templates/index.liquid");
        assertThat(templateModule(graph, "product.json").path()).isEqualTo("templates/product.json");
        assertThat(sectionModule(graph, "section1").path()).isEqualTo("sections/section1.liquid");
        assertThat(snippetModule(graph, "price").path()).isEqualTo("snippets/price.liquid");
        assertThat(layoutModule(graph, "theme").path()).isEqualTo("layout/theme.liquid");
        assertThat(blockModule(graph, "slide").path()).isEqualTo("blocks/slide.liquid");
        assertThat(assetModule(graph, "theme.css").path()).isEqualTo("assets/theme.css");
    }

    @Test
    @Tag("unit")
    void getOrCreateReturnsTheSameModule() {
        ThemeGraph graph = new ThemeGraph("/theme");
        ThemeModule first = snippetModule(graph, "price");

        assertThat(graph.getOrCreateModule("./snippets/price.liquid", LiquidModuleKind.SNIPPET)).isSameAs(first);
        assertThat(graph.modules()).hasSize(1);
        assertThatThrownBy(() -> graph.getOrCreateModule("snippets/price.liquid", LiquidModuleKind.ASSET))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void onlyTemplatesAndLayoutsAreEntryPoints() {
        ThemeGraph graph = new ThemeGraph("/theme");
        ThemeModule layout = layoutModule(graph, "theme");

        graph.addEntryPoint(layout);
        graph.addEntryPoint(layout);

        assertThat(graph.entryPoints()).containsExactly(layout);
        assertThatThrownBy(() -> graph.addEntryPoint(snippetModule(graph, "price")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> graph.addEntryPoint(layoutModule(new ThemeGraph("/other"), "theme")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
