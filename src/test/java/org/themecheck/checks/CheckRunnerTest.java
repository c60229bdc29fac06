package org.themecheck.checks;

import com.typesafe.config.ConfigFactory;
import org.themecheck.api.CancellationToken;
import org.themecheck.checks.rules.BlockIdUsage;
import org.themecheck.frontend.io.InMemoryThemeFileSystem;
import org.themecheck.frontend.parser.ILiquidParser;
import org.themecheck.frontend.parser.LiquidParser;
import org.themecheck.frontend.parser.ast.Position;
import org.themecheck.frontend.parser.ast.TextNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CheckRunnerTest {

    private static final String BLOCK_ID_SOURCE = "{% if block.id == '1' %}{% endif %}";

    private static CheckRunner runner(CheckRegistry registry, CheckConfiguration configuration) {
        return new CheckRunner(registry, configuration, new LiquidParser(), null);
    }

    @Test
    @Tag("unit")
    void unparsableFileYieldsOneSyntaxError() {
        CheckRunResult result = runner(CheckRegistry.initializeWithDefaults(), CheckConfiguration.empty())
                .run(List.of(new SourceFile("a.liquid", "ok {% if x %}")), CancellationToken.none());

        assertThat(result.filesChecked()).isEqualTo(1);
        assertThat(result.offenses()).singleElement().satisfies(offense -> {
            assertThat(offense.checkCode()).isEqualTo(CheckRunner.SYNTAX_ERROR_CODE);
            assertThat(offense.severity()).isEqualTo(Severity.ERROR);
            assertThat(offense.position()).isEqualTo(new Position(3, 13));
        });
    }

    @Test
    @Tag("unit")
    void invalidCheckConfigurationSkipsTheCheckWithOneOffense() {
        CheckConfiguration configuration = CheckConfiguration.from(
                ConfigFactory.parseString("theme-check.checks.BlockIdUsage.severity = loud"), "theme/.theme-check.conf");

        CheckRunResult result = runner(CheckRegistry.initializeWithDefaults(), configuration).run(List.of(
                new SourceFile("a.liquid", BLOCK_ID_SOURCE),
                new SourceFile("b.liquid", BLOCK_ID_SOURCE)), CancellationToken.none());

        assertThat(result.offenses()).singleElement().satisfies(offense -> {
            assertThat(offense.checkCode()).isEqualTo("BlockIdUsage");
            assertThat(offense.severity()).isEqualTo(Severity.ERROR);
            assertThat(offense.fileUri()).isEqualTo("theme/.theme-check.conf");
            assertThat(offense.message()).startsWith(CheckRunner.CONFIG_ERROR_PREFIX);
        });
    }

    @Test
    @Tag("unit")
    void cancelledTokenAbandonsTheRun() {
        CancellationToken token = CancellationToken.none();
        ICheckDefinition cancelling = TestChecks.check("Cancelling", context -> HandlerTable.builder()
                .on(TextNode.class, (node, ancestors) -> token.cancel())
                .build());
        CheckRunner runner = runner(CheckRegistry.builder().register(cancelling).build(), CheckConfiguration.empty());

        assertThatThrownBy(() -> runner.run(List.of(
                new SourceFile("a.liquid", "text"),
                new SourceFile("b.liquid", "text")), token))
                .isInstanceOf(CancellationException.class);
    }

    @Test
    @Tag("unit")
    void checkThatCannotBeCreatedReportsInternalError() {
        ICheckDefinition broken = TestChecks.check("Broken", context -> {
            throw new IllegalStateException("no handlers");
        });
        CheckRegistry registry = CheckRegistry.builder().register(broken).register(new BlockIdUsage()).build();

        CheckRunResult result = runner(registry, CheckConfiguration.empty())
                .run(List.of(new SourceFile("a.liquid", BLOCK_ID_SOURCE)), CancellationToken.none());

        assertThat(result.offenses()).extracting(Offense::checkCode).containsExactly("Broken", "BlockIdUsage");
    }

    @Test
    @Tag("unit")
    void checkCreationErrorIsIsolated() {
        ICheckDefinition broken = TestChecks.check("Broken", context -> {
            throw new NoClassDefFoundError("missing/Helper");
        });
        CheckRegistry registry = CheckRegistry.builder().register(broken).register(new BlockIdUsage()).build();

        CheckRunResult result = runner(registry, CheckConfiguration.empty()).run(List.of(
                new SourceFile("a.liquid", BLOCK_ID_SOURCE),
                new SourceFile("b.liquid", BLOCK_ID_SOURCE)), CancellationToken.none());

        assertThat(result.offensesFor("a.liquid")).extracting(Offense::checkCode).containsExactly("Broken", "BlockIdUsage");
        assertThat(result.offensesFor("b.liquid")).extracting(Offense::checkCode).containsExactly("Broken", "BlockIdUsage");
    }

    @Test
    @Tag("unit")
    void parserCrashOnOneFileIsReportedAndTheRunContinues() {
        LiquidParser liquidParser = new LiquidParser();
        ILiquidParser crashing = source -> {
            if (source.startsWith("crash")) {
                throw new IllegalStateException("parser bug");
            }
            return liquidParser.parse(source);
        };
        CheckRunner runner = new CheckRunner(CheckRegistry.initializeWithDefaults(), CheckConfiguration.empty(),
                crashing, null);

        CheckRunResult result = runner.run(List.of(
                new SourceFile("a.liquid", "crash"),
                new SourceFile("b.liquid", BLOCK_ID_SOURCE)), CancellationToken.none());

        assertThat(result.offensesFor("a.liquid")).singleElement().satisfies(offense -> {
            assertThat(offense.checkCode()).isEqualTo(CheckRunner.SYNTAX_ERROR_CODE);
            assertThat(offense.message()).isEqualTo(CheckRunner.PARSER_FAILURE_PREFIX + "parser bug");
            assertThat(offense.position()).isEqualTo(new Position(0, 0));
        });
        assertThat(result.offensesFor("b.liquid")).extracting(Offense::checkCode).containsExactly("BlockIdUsage");
    }

    @Test
    @Tag("unit")
    void reportedRangesAreClampedToTheFile() {
        ICheckDefinition sloppy = TestChecks.check("Sloppy", context -> HandlerTable.builder()
                .on(TextNode.class, (node, ancestors) -> context.report("too wide", -5, 999, "narrow it"))
                .build());

        CheckRunResult result = runner(CheckRegistry.builder().register(sloppy).build(), CheckConfiguration.empty())
                .run(List.of(new SourceFile("a.liquid", "hello")), CancellationToken.none());

        assertThat(result.offenses()).singleElement().satisfies(offense -> {
            assertThat(offense.position()).isEqualTo(new Position(0, 5));
            assertThat(offense.optionalSuggestion()).contains("narrow it");
        });
    }

    @Test
    @Tag("unit")
    void themeRunChecksFilesWithConfiguredExtensions() {
        InMemoryThemeFileSystem fs = new InMemoryThemeFileSystem()
                .put("/theme/sections/a.liquid", BLOCK_ID_SOURCE)
                .put("/theme/snippets/b.liquid", BLOCK_ID_SOURCE)
                .put("/theme/templates/index.json", "{}");
        CheckRunner runner = new CheckRunner(CheckRegistry.initializeWithDefaults(), CheckConfiguration.empty(),
                new LiquidParser(), fs);

        CheckRunResult result = runner.runTheme("/theme", Set.of(".liquid"), CancellationToken.none());

        assertThat(result.filesChecked()).isEqualTo(2);
        assertThat(result.offensesByFile().keySet())
                .containsExactly("/theme/sections/a.liquid", "/theme/snippets/b.liquid");
        assertThat(result.offenseCount()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void themeRunNeedsFileSystem() {
        CheckRunner runner = runner(CheckRegistry.initializeWithDefaults(), CheckConfiguration.empty());

        assertThatThrownBy(() -> runner.runTheme("/theme", Set.of(".liquid"), CancellationToken.none()))
                .isInstanceOf(IllegalStateException.class);
    }
}
