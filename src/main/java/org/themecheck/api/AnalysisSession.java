package org.themecheck.api;

import com.typesafe.config.Config;
import org.themecheck.checks.CheckConfiguration;
import org.themecheck.checks.CheckRegistry;
import org.themecheck.checks.CheckRunResult;
import org.themecheck.checks.CheckRunner;
import org.themecheck.checks.OffenseCollector;
import org.themecheck.checks.SourceFile;
import org.themecheck.frontend.io.IThemeFileSystem;
import org.themecheck.frontend.parser.ILiquidParser;
import org.themecheck.frontend.parser.LiquidParser;
import org.themecheck.graph.ThemeGraph;
import org.themecheck.graph.ThemeGraphBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Context of one analysis: configuration, checks, file system and the bounded executor modules are
 * parsed on. Every run takes its own {@link CancellationToken}; cancelling one run leaves later runs of
 * the session unaffected. Closing the session shuts the executor down.
 */
public final class AnalysisSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AnalysisSession.class);

    public static final String PARALLELISM_PATH = "theme-check.graph.parallelism";
    public static final String EXTENSIONS_PATH = "theme-check.files.extensions";

    private final CheckRegistry registry;
    private final CheckConfiguration checkConfiguration;
    private final IThemeFileSystem fileSystem;
    private final ILiquidParser parser;
    private final Set<String> extensions;
    private final int parallelism;
    private final ExecutorService executor;

    /**
     * @param config       The resolved application configuration.
     * @param configSource The file the configuration came from.
     * @param registry     The checks to run.
     * @param fileSystem   The theme's file system.
     * @param parser       The Liquid parser.
     */
    public AnalysisSession(Config config, String configSource, CheckRegistry registry,
                           IThemeFileSystem fileSystem, ILiquidParser parser) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.checkConfiguration = CheckConfiguration.from(config, configSource);
        this.extensions = new LinkedHashSet<>(config.getStringList(EXTENSIONS_PATH));
        this.parallelism = config.getInt(PARALLELISM_PATH);
        if (parallelism < 1) {
            throw new IllegalArgumentException(PARALLELISM_PATH + " must be at least 1, was " + parallelism);
        }
        this.executor = parallelism > 1 ? Executors.newFixedThreadPool(parallelism) : null;
    }

    /**
     * Opens a session with the default checks and parser.
     */
    public static AnalysisSession open(Config config, String configSource, IThemeFileSystem fileSystem) {
        return new AnalysisSession(config, configSource, CheckRegistry.initializeWithDefaults(),
                fileSystem, new LiquidParser());
    }

    public CheckRunner checkRunner() {
        return new CheckRunner(registry, checkConfiguration, parser, fileSystem);
    }

    public ThemeGraphBuilder graphBuilder() {
        if (executor == null) {
            return new ThemeGraphBuilder(fileSystem, parser);
        }
        return new ThemeGraphBuilder(fileSystem, parser, executor, parallelism);
    }

    public CheckRunResult check(List<SourceFile> files) {
        return check(files, CancellationToken.none());
    }

    public CheckRunResult check(List<SourceFile> files, CancellationToken token) {
        return checkRunner().run(files, token);
    }

    public CheckRunResult checkTheme(String root) {
        return checkTheme(root, CancellationToken.none());
    }

    /**
     * Checks every file of the theme with one of the configured extensions.
     *
     * @param token Cancellation token of this run only.
     */
    public CheckRunResult checkTheme(String root, CancellationToken token) {
        return checkRunner().runTheme(root, extensions, token);
    }

    public ThemeGraph buildGraph(String root, OffenseCollector offenses) {
        return buildGraph(root, offenses, CancellationToken.none());
    }

    /**
     * Builds the dependency graph of the theme; broken references are added to {@code offenses}.
     *
     * @param token Cancellation token of this run only.
     */
    public ThemeGraph buildGraph(String root, OffenseCollector offenses, CancellationToken token) {
        return graphBuilder().build(root, offenses, token);
    }

    @Override
    public void close() {
        if (executor == null) return;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Parse executor did not terminate within 10 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
