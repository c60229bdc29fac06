package org.themecheck.graph;

import org.themecheck.frontend.io.ThemePaths;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of a theme module, determined by the top-level directory it lives in.
 */
public enum LiquidModuleKind {
    TEMPLATE("templates"),
    SECTION("sections"),
    SNIPPET("snippets"),
    LAYOUT("layout"),
    BLOCK("blocks"),
    ASSET("assets");

    private final String directory;

    LiquidModuleKind(String directory) {
        this.directory = directory;
    }

    /**
     * @return The theme directory holding modules of this kind.
     */
    public String directory() {
        return directory;
    }

    /**
     * @return true for kinds the host renders without another module referencing them.
     */
    public boolean isEntryPoint() {
        return this == TEMPLATE || this == LAYOUT;
    }

    /**
     * Infers the kind of a theme-relative path from its directory and extension.
     *
     * @param relativePath A theme-relative path such as {@code snippets/price.liquid}.
     * @return The kind, or empty if the path is not a module.
     */
    public static Optional<LiquidModuleKind> fromPath(String relativePath) {
        String path = ThemePaths.normalize(relativePath);
        int slash = path.indexOf('/');
        if (slash < 0) {
            return Optional.empty();
        }
        String top = path.substring(0, slash);
        for (LiquidModuleKind kind : values()) {
            if (kind.directory.equals(top) && kind.accepts(path)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Builds the module path for a name as written in a reference, e.g. {@code price} for a snippet
     * becomes {@code snippets/price.liquid}. Names that already carry the directory or an extension keep them.
     */
    public String pathFor(String name) {
        String path = ThemePaths.normalize(name);
        if (!path.startsWith(directory + "/")) {
            path = directory + "/" + path;
        }
        if (this != ASSET && !path.endsWith(".liquid") && !(allowsJson() && path.endsWith(".json"))) {
            path = path + ".liquid";
        }
        return path;
    }

    private boolean accepts(String path) {
        if (this == ASSET) return true;
        return path.endsWith(".liquid") || (allowsJson() && path.endsWith(".json"));
    }

    private boolean allowsJson() {
        return this == TEMPLATE || this == SECTION;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
