package org.themecheck.graph;

/**
 * Factories returning the module of a given kind for a name or path, inserting it into the graph if absent.
 */
public final class ThemeModules {

    private ThemeModules() {}

    public static ThemeModule templateModule(ThemeGraph graph, String name) {
        return module(graph, LiquidModuleKind.TEMPLATE, name);
    }

    public static ThemeModule sectionModule(ThemeGraph graph, String name) {
        return module(graph, LiquidModuleKind.SECTION, name);
    }

    public static ThemeModule snippetModule(ThemeGraph graph, String name) {
        return module(graph, LiquidModuleKind.SNIPPET, name);
    }

    public static ThemeModule layoutModule(ThemeGraph graph, String name) {
        return module(graph, LiquidModuleKind.LAYOUT, name);
    }

    public static ThemeModule blockModule(ThemeGraph graph, String name) {
        return module(graph, LiquidModuleKind.BLOCK, name);
    }

    public static ThemeModule assetModule(ThemeGraph graph, String name) {
        return module(graph, LiquidModuleKind.ASSET, name);
    }

    private static ThemeModule module(ThemeGraph graph, LiquidModuleKind kind, String name) {
        return graph.getOrCreateModule(kind.pathFor(name), kind);
    }
}
