package org.themecheck.checks;

import org.themecheck.api.CancellationToken;
import org.themecheck.frontend.io.IThemeFileSystem;
import org.themecheck.frontend.io.ThemeFileWalker;
import org.themecheck.frontend.io.ThemePaths;
import org.themecheck.frontend.parser.ILiquidParser;
import org.themecheck.frontend.parser.LiquidParseException;
import org.themecheck.frontend.parser.ast.DocumentNode;
import org.themecheck.frontend.parser.ast.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Runs the registered checks over a set of files.
 *
 * <p>Per run, every check's configuration is validated once; a check with an invalid entry yields one
 * config-error offense and is skipped. Per file, the source is parsed, each active check creates its
 * handlers and the {@link VisitorDispatchEngine} walks the tree. A file that does not parse yields one
 * {@value #SYNTAX_ERROR_CODE} offense, as does a file the parser crashes on. Cancellation is checked before each file; a cancelled run throws
 * and returns nothing.</p>
 */
public final class CheckRunner {

    private static final Logger log = LoggerFactory.getLogger(CheckRunner.class);

    public static final String SYNTAX_ERROR_CODE = "LiquidHTMLSyntaxError";
    public static final String CONFIG_ERROR_PREFIX = "Check skipped: ";
    public static final String PARSER_FAILURE_PREFIX = "Could not parse file: ";

    private final CheckRegistry registry;
    private final CheckConfiguration configuration;
    private final ILiquidParser parser;
    private final IThemeFileSystem fileSystem;
    private final VisitorDispatchEngine engine = new VisitorDispatchEngine();

    /**
     * @param registry      The checks to run.
     * @param configuration The per-check configuration.
     * @param parser        The Liquid parser.
     * @param fileSystem    The theme's file system for cross-file lookups and {@link #runTheme}; may be null.
     */
    public CheckRunner(CheckRegistry registry, CheckConfiguration configuration,
                       ILiquidParser parser, IThemeFileSystem fileSystem) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.fileSystem = fileSystem;
    }

    private record ActiveCheck(ICheckDefinition definition, CheckSettings settings) {}

    /**
     * Checks the given files.
     *
     * @param files The files, in the order they are checked.
     * @param token Cancellation token polled before each file.
     * @return The collected offenses.
     * @throws java.util.concurrent.CancellationException if the token is cancelled during the run.
     */
    public CheckRunResult run(List<SourceFile> files, CancellationToken token) {
        OffenseCollector offenses = new OffenseCollector(registry);
        List<ActiveCheck> active = activeChecks(offenses);
        log.info("Running {} of {} checks on {} files", active.size(), registry.checks().size(), files.size());

        for (SourceFile file : files) {
            token.throwIfCancelled();
            checkFile(file, active, offenses);
        }

        log.info("Check run finished: {} offenses in {} files", offenses.size(), offenses.byFile().size());
        return new CheckRunResult(files.size(), offenses.byFile());
    }

    /**
     * Checks every file below {@code root} whose name ends with one of {@code extensions}.
     *
     * @param root       The theme root.
     * @param extensions File name suffixes to check, e.g. {@code .liquid}.
     * @param token      Cancellation token polled before each file.
     * @return The collected offenses.
     * @throws IllegalStateException if the runner has no file system.
     */
    public CheckRunResult runTheme(String root, Set<String> extensions, CancellationToken token) {
        if (fileSystem == null) {
            throw new IllegalStateException("A theme run needs a file system");
        }
        List<SourceFile> files = new ArrayList<>();
        for (String path : ThemeFileWalker.listFiles(fileSystem, root, "")) {
            token.throwIfCancelled();
            if (extensions.stream().noneMatch(path::endsWith)) continue;
            String uri = ThemePaths.join(root, path);
            try {
                files.add(new SourceFile(uri, fileSystem.readFile(uri)));
            } catch (IOException e) {
                log.warn("Skipping unreadable file {}", uri, e);
            }
        }
        return run(files, token);
    }

    private List<ActiveCheck> activeChecks(OffenseCollector offenses) {
        List<ActiveCheck> active = new ArrayList<>();
        for (ICheckDefinition check : registry.checks()) {
            try {
                CheckSettings settings = configuration.settingsFor(check.meta());
                if (settings.enabled()) {
                    active.add(new ActiveCheck(check, settings));
                }
            } catch (CheckConfigurationException e) {
                log.warn("Skipping check {}: {}", e.getCheckCode(), e.getMessage());
                offenses.add(new Offense(e.getCheckCode(), Severity.ERROR, CONFIG_ERROR_PREFIX + e.getMessage(),
                        configuration.source(), new Position(0, 0)));
            }
        }
        return active;
    }

    private void checkFile(SourceFile file, List<ActiveCheck> active, OffenseCollector offenses) {
        log.debug("Checking {}", file.uri());
        DocumentNode root;
        try {
            root = parser.parse(file.text());
        } catch (LiquidParseException e) {
            Position position = e.getPosition();
            int length = file.text().length();
            int start = Math.min(position.start(), length);
            offenses.add(new Offense(SYNTAX_ERROR_CODE, Severity.ERROR, e.getMessage(), file.uri(),
                    new Position(start, Math.max(start, Math.min(position.end(), length)))));
            return;
        } catch (CancellationException e) {
            throw e;
        } catch (Throwable t) {
            log.warn("Parser failed on {}", file.uri(), t);
            String detail = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
            offenses.add(new Offense(SYNTAX_ERROR_CODE, Severity.ERROR, PARSER_FAILURE_PREFIX + detail,
                    file.uri(), new Position(0, 0)));
            return;
        }

        DispatchTable table = new DispatchTable();
        for (ActiveCheck check : active) {
            CheckMeta meta = check.definition().meta();
            CheckContext context = new CheckContext(meta, check.settings(), file, fileSystem, offenses);
            try {
                table.add(meta.code(), context, check.definition().create(context));
            } catch (CancellationException e) {
                throw e;
            } catch (Throwable t) {
                log.warn("Check {} could not be created for {}", meta.code(), file.uri(), t);
                context.reportInternalError(new Position(0, 0), t);
            }
        }
        engine.dispatch(root, table);
    }
}
