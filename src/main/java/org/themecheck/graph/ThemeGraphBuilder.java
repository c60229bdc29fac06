package org.themecheck.graph;

import org.themecheck.api.CancellationToken;
import org.themecheck.checks.Offense;
import org.themecheck.checks.OffenseCollector;
import org.themecheck.checks.Severity;
import org.themecheck.frontend.io.FileStat;
import org.themecheck.frontend.io.FileType;
import org.themecheck.frontend.io.IThemeFileSystem;
import org.themecheck.frontend.io.ThemeFileWalker;
import org.themecheck.frontend.io.ThemePaths;
import org.themecheck.frontend.parser.ILiquidParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Builds the {@link ThemeGraph} of a theme.
 *
 * <p>The build seeds the graph with every template and layout, then walks references breadth-first.
 * Modules are parsed in batches of at most {@code parallelism} on the executor; results are applied
 * by the calling thread in submission order, so the graph has a single writer and its module and edge
 * order do not depend on scheduling. Files no entry point reaches are appended afterwards in path
 * order. Each module is parsed at most once, which makes reference cycles terminate.</p>
 *
 * <p>After the walk, every reference to a module whose file does not exist is reported as a
 * {@value #BROKEN_REFERENCE_CODE} offense at the reference.</p>
 */
public final class ThemeGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(ThemeGraphBuilder.class);

    public static final String BROKEN_REFERENCE_CODE = "BrokenReference";

    private static final List<LiquidModuleKind> ENUMERATION_ORDER = List.of(
            LiquidModuleKind.TEMPLATE, LiquidModuleKind.LAYOUT, LiquidModuleKind.SECTION,
            LiquidModuleKind.SNIPPET, LiquidModuleKind.BLOCK, LiquidModuleKind.ASSET);

    private final IThemeFileSystem fileSystem;
    private final ILiquidParser parser;
    private final Executor executor;
    private final int parallelism;

    /**
     * Creates a builder that parses modules one at a time on the calling thread.
     */
    public ThemeGraphBuilder(IThemeFileSystem fileSystem, ILiquidParser parser) {
        this(fileSystem, parser, Runnable::run, 1);
    }

    /**
     * @param fileSystem  The theme's file system.
     * @param parser      The Liquid parser.
     * @param executor    Runs module parsing; the builder does not shut it down.
     * @param parallelism Maximum number of modules parsed concurrently.
     */
    public ThemeGraphBuilder(IThemeFileSystem fileSystem, ILiquidParser parser, Executor executor, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.parallelism = parallelism;
    }

    /**
     * Builds the graph of the theme at {@code root}.
     *
     * @param root     The theme root.
     * @param offenses Receives {@value #BROKEN_REFERENCE_CODE} offenses.
     * @param token    Cancellation token polled between modules.
     * @return The graph.
     * @throws IllegalArgumentException if {@code root} is not a directory.
     * @throws CancellationException if the token is cancelled during the build.
     */
    public ThemeGraph build(String root, OffenseCollector offenses, CancellationToken token) {
        requireDirectory(root);
        ThemeGraph graph = new ThemeGraph(root);
        Walk walk = new Walk(graph, new ModuleLoader(fileSystem, parser, root), token);

        List<String> files = enumerate(root);
        for (String path : files) {
            LiquidModuleKind kind = LiquidModuleKind.fromPath(path).orElseThrow();
            if (kind.isEntryPoint()) {
                ThemeModule module = graph.getOrCreateModule(path, kind);
                graph.addEntryPoint(module);
                walk.enqueue(module);
            }
        }
        walk.drain();

        for (String path : files) {
            if (graph.module(path).isEmpty()) {
                walk.enqueue(graph.getOrCreateModule(path, LiquidModuleKind.fromPath(path).orElseThrow()));
                walk.drain();
            }
        }

        reportBrokenReferences(graph, offenses);
        log.info("Built theme graph for {}: {} modules, {} edges, {} unresolved references",
                root, graph.modules().size(), graph.edges().size(), graph.unresolvedReferences().size());
        return graph;
    }

    private void requireDirectory(String root) {
        FileStat stat;
        try {
            stat = fileSystem.stat(root);
        } catch (IOException e) {
            throw new IllegalArgumentException("Theme root " + root + " cannot be read", e);
        }
        if (stat.type() != FileType.DIRECTORY) {
            throw new IllegalArgumentException("Theme root " + root + " is not a directory");
        }
    }

    private List<String> enumerate(String root) {
        List<String> files = new ArrayList<>();
        for (LiquidModuleKind kind : ENUMERATION_ORDER) {
            ThemeFileWalker.listFiles(fileSystem, root, kind.directory()).stream()
                    .filter(path -> LiquidModuleKind.fromPath(path).orElse(null) == kind)
                    .sorted()
                    .forEach(files::add);
        }
        return files;
    }

    private void reportBrokenReferences(ThemeGraph graph, OffenseCollector offenses) {
        for (ModuleReference reference : graph.references()) {
            Optional<ThemeModule> target = graph.module(reference.target());
            if (target.isPresent() && !target.get().exists()) {
                offenses.add(new Offense(BROKEN_REFERENCE_CODE, Severity.ERROR,
                        "'" + reference.target() + "' does not exist",
                        ThemePaths.join(graph.root(), reference.source()), reference.position()));
            }
        }
    }

    /**
     * State of one build: the worklist and the set of modules already handed to the loader.
     */
    private final class Walk {
        private final ThemeGraph graph;
        private final ModuleLoader loader;
        private final CancellationToken token;
        private final Deque<ThemeModule> worklist = new ArrayDeque<>();
        private final Set<String> seen = new HashSet<>();

        Walk(ThemeGraph graph, ModuleLoader loader, CancellationToken token) {
            this.graph = graph;
            this.loader = loader;
            this.token = token;
        }

        void enqueue(ThemeModule module) {
            if (seen.add(module.path())) {
                worklist.add(module);
            }
        }

        void drain() {
            while (!worklist.isEmpty()) {
                token.throwIfCancelled();
                List<ThemeModule> batch = new ArrayList<>();
                while (!worklist.isEmpty() && batch.size() < parallelism) {
                    batch.add(worklist.poll());
                }
                List<CompletableFuture<LoadedModule>> pending = new ArrayList<>();
                try {
                    for (ThemeModule module : batch) {
                        pending.add(CompletableFuture.supplyAsync(() -> loader.load(module.path(), module.kind()), executor));
                    }
                    for (int i = 0; i < batch.size(); i++) {
                        token.throwIfCancelled();
                        apply(batch.get(i), await(batch.get(i), pending.get(i)));
                    }
                } finally {
                    pending.forEach(future -> future.cancel(true));
                }
            }
        }

        private LoadedModule await(ThemeModule module, CompletableFuture<LoadedModule> future) {
            try {
                return future.join();
            } catch (CompletionException e) {
                log.warn("Loading module {} failed", module.path(), e.getCause());
                return LoadedModule.unparsable();
            }
        }

        private void apply(ThemeModule module, LoadedModule loaded) {
            graph.recordLoad(module, loaded.exists(), loaded.status());
            for (ExtractedReference reference : loaded.references()) {
                if (reference.isDynamic()) {
                    graph.addUnresolvedReference(new UnresolvedReference(
                            module.path(), reference.tagName(), reference.expression(), reference.position()));
                    continue;
                }
                ThemeModule target = graph.getOrCreateModule(reference.targetPath(), reference.targetKind());
                graph.addReference(module, new ModuleReference(
                        module.path(), target.path(), reference.position(), reference.tagName()));
                graph.bind(module, target);
                enqueue(target);
            }
        }
    }
}
