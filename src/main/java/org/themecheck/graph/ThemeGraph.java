package org.themecheck.graph;

import org.themecheck.frontend.io.ThemePaths;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The module dependency graph of one theme.
 *
 * <p>Modules are kept in insertion order and edges in bind order; serialization relies on both.
 * The graph is not thread-safe and must have a single writer.</p>
 */
public final class ThemeGraph {

    /**
     * A directed dependency edge.
     *
     * @param source Path of the referencing module.
     * @param target Path of the referenced module.
     */
    public record Edge(String source, String target) {}

    private final String root;
    private final Map<String, ThemeModule> modules = new LinkedHashMap<>();
    private final List<ThemeModule> entryPoints = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final List<UnresolvedReference> unresolvedReferences = new ArrayList<>();

    /**
     * @param root The theme root the module paths are relative to.
     */
    public ThemeGraph(String root) {
        this.root = root;
    }

    public String root() {
        return root;
    }

    /**
     * @return Path to module, in insertion order.
     */
    public Map<String, ThemeModule> modules() {
        return Collections.unmodifiableMap(modules);
    }

    public Optional<ThemeModule> module(String path) {
        return Optional.ofNullable(modules.get(ThemePaths.normalize(path)));
    }

    /**
     * @return The entry points in the order they were added.
     */
    public List<ThemeModule> entryPoints() {
        return Collections.unmodifiableList(entryPoints);
    }

    /**
     * @return All edges in the order they were bound.
     */
    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public List<UnresolvedReference> unresolvedReferences() {
        return Collections.unmodifiableList(unresolvedReferences);
    }

    /**
     * @return The static references of all modules, in module insertion order.
     */
    public List<ModuleReference> references() {
        List<ModuleReference> all = new ArrayList<>();
        modules.values().forEach(module -> all.addAll(module.references()));
        return all;
    }

    /**
     * Returns the module for {@code path}, inserting it if absent.
     *
     * @param path A theme-relative path; it is normalized.
     * @param kind The kind to create the module with.
     * @return The existing or new module.
     * @throws IllegalArgumentException if a module exists for the path with another kind.
     */
    public ThemeModule getOrCreateModule(String path, LiquidModuleKind kind) {
        String normalized = ThemePaths.normalize(path);
        ThemeModule module = modules.computeIfAbsent(normalized, p -> new ThemeModule(p, kind));
        if (module.kind() != kind) {
            throw new IllegalArgumentException(
                    "Module " + normalized + " already exists as " + module.kind() + ", not " + kind);
        }
        return module;
    }

    /**
     * Marks a module as an entry point.
     *
     * @throws IllegalArgumentException if the module is not in this graph or is neither template nor layout.
     */
    public void addEntryPoint(ThemeModule module) {
        if (modules.get(module.path()) != module) {
            throw new IllegalArgumentException("Module " + module.path() + " is not part of this graph");
        }
        if (!module.kind().isEntryPoint()) {
            throw new IllegalArgumentException("Module " + module.path() + " of kind " + module.kind()
                    + " cannot be an entry point");
        }
        if (!entryPoints.contains(module)) {
            entryPoints.add(module);
        }
    }

    /**
     * Adds the edge {@code source -> target}. Binding the same pair again has no effect.
     *
     * @return true if the edge is new.
     */
    public boolean bind(ThemeModule source, ThemeModule target) {
        if (!source.addDependency(target.path())) {
            return false;
        }
        target.addDependent(source.path());
        edges.add(new Edge(source.path(), target.path()));
        return true;
    }

    void addReference(ThemeModule source, ModuleReference reference) {
        source.addReference(reference);
    }

    void addUnresolvedReference(UnresolvedReference reference) {
        unresolvedReferences.add(reference);
    }

    void recordLoad(ThemeModule module, boolean exists, ParseStatus status) {
        module.setExists(exists);
        module.setParseStatus(status);
    }
}
