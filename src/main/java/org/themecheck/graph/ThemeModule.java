package org.themecheck.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One file of the theme. Only {@link ThemeGraph} mutates modules.
 */
public final class ThemeModule {

    private final String path;
    private final LiquidModuleKind kind;
    private final Set<String> dependencies = new LinkedHashSet<>();
    private final Set<String> dependents = new LinkedHashSet<>();
    private final List<ModuleReference> references = new ArrayList<>();
    private ParseStatus parseStatus = ParseStatus.OK;
    private boolean exists = true;

    ThemeModule(String path, LiquidModuleKind kind) {
        this.path = path;
        this.kind = kind;
    }

    /**
     * @return The normalized theme-relative path, unique within a graph.
     */
    public String path() {
        return path;
    }

    public LiquidModuleKind kind() {
        return kind;
    }

    /**
     * @return Paths of the modules this module references, in bind order.
     */
    public Set<String> dependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    /**
     * @return Paths of the modules referencing this module, in bind order.
     */
    public Set<String> dependents() {
        return Collections.unmodifiableSet(dependents);
    }

    /**
     * @return Every static reference made by this module, including repeated ones.
     */
    public List<ModuleReference> references() {
        return Collections.unmodifiableList(references);
    }

    public ParseStatus parseStatus() {
        return parseStatus;
    }

    /**
     * @return false if the module was referenced but its file does not exist.
     */
    public boolean exists() {
        return exists;
    }

    boolean addDependency(String target) {
        return dependencies.add(target);
    }

    void addDependent(String source) {
        dependents.add(source);
    }

    void addReference(ModuleReference reference) {
        references.add(reference);
    }

    void setParseStatus(ParseStatus parseStatus) {
        this.parseStatus = parseStatus;
    }

    void setExists(boolean exists) {
        this.exists = exists;
    }

    @Override
    public String toString() {
        return kind + ":" + path;
    }
}
