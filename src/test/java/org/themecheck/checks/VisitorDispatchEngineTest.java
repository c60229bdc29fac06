package org.themecheck.checks;

import org.themecheck.api.CancellationToken;
import org.themecheck.checks.rules.BlockIdUsage;
import org.themecheck.frontend.parser.LiquidParser;
import org.themecheck.frontend.parser.ast.LiquidTag;
import org.themecheck.frontend.parser.ast.NodeKind;
import org.themecheck.frontend.parser.ast.TextNode;
import org.themecheck.frontend.parser.ast.VariableLookup;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests dispatching syntax tree nodes to the handlers of the active checks.
 */
public class VisitorDispatchEngineTest {

    private static final String BLOCK_ID_SOURCE = "{% if block.id == '1' %}text{% endif %}";

    private static CheckRunResult run(CheckRegistry registry, List<SourceFile> files) {
        return new CheckRunner(registry, CheckConfiguration.empty(), new LiquidParser(), null)
                .run(files, CancellationToken.none());
    }

    @Test
    @Tag("unit")
    void handlersRunInDocumentOrderWithAncestors() {
        List<String> visits = new ArrayList<>();
        ICheckDefinition recorder = TestChecks.check("Recorder", context -> HandlerTable.builder()
                .on(LiquidTag.class, (node, ancestors) -> visits.add("tag " + node.name() + "@" + ancestors.depth()))
                .on(TextNode.class, (node, ancestors) -> visits.add("text " + node.value() + "@" + ancestors.depth()))
                .build());

        run(CheckRegistry.builder().register(recorder).build(),
                List.of(new SourceFile("a.liquid", "x{% if a %}y{% endif %}")));

        assertThat(visits).containsExactly("text x@1", "tag if@1", "text y@3");
    }

    @Test
    @Tag("unit")
    void failingHandlerBecomesInternalErrorWithoutStoppingOtherChecks() {
        ICheckDefinition exploding = TestChecks.check("Exploding", context -> HandlerTable.builder()
                .on(VariableLookup.class, (node, ancestors) -> {
                    if (context.fileUri().equals("a.liquid")) {
                        throw new IllegalStateException("boom");
                    }
                })
                .build());
        CheckRegistry registry = CheckRegistry.builder().register(exploding).register(new BlockIdUsage()).build();

        CheckRunResult result = run(registry, List.of(
                new SourceFile("a.liquid", BLOCK_ID_SOURCE),
                new SourceFile("b.liquid", BLOCK_ID_SOURCE)));

        assertThat(result.offensesFor("a.liquid")).extracting(Offense::checkCode)
                .containsExactly("Exploding", "BlockIdUsage");
        assertThat(result.offensesFor("a.liquid").get(0)).satisfies(offense -> {
            assertThat(offense.severity()).isEqualTo(Severity.ERROR);
            assertThat(offense.message()).isEqualTo("Internal error in check Exploding: boom");
        });
        assertThat(result.offensesFor("b.liquid")).extracting(Offense::checkCode).containsExactly("BlockIdUsage");
    }

    @Test
    @Tag("unit")
    void handlerThrowingAnErrorDoesNotAbortTheRun() {
        ICheckDefinition exploding = TestChecks.check("Exploding", context -> HandlerTable.builder()
                .on(VariableLookup.class, (node, ancestors) -> {
                    if (context.fileUri().equals("a.liquid")) {
                        throw new AssertionError("boom");
                    }
                })
                .build());
        CheckRegistry registry = CheckRegistry.builder().register(exploding).register(new BlockIdUsage()).build();

        CheckRunResult result = run(registry, List.of(
                new SourceFile("a.liquid", BLOCK_ID_SOURCE),
                new SourceFile("b.liquid", BLOCK_ID_SOURCE)));

        assertThat(result.offensesFor("a.liquid")).extracting(Offense::message)
                .contains("Internal error in check Exploding: boom");
        assertThat(result.offensesFor("b.liquid")).extracting(Offense::checkCode).containsExactly("BlockIdUsage");
    }

    @Test
    @Tag("unit")
    void deeplyNestedFileIsCheckedWithoutOverflowingTheStack() {
        int depth = 20_000;
        String deep = "{% if a %}".repeat(depth) + "{% endif %}".repeat(depth);
        List<Integer> depths = new ArrayList<>();
        ICheckDefinition counter = TestChecks.check("Counter", context -> HandlerTable.builder()
                .on(LiquidTag.class, (node, ancestors) -> {
                    if (context.fileUri().equals("deep.liquid")) {
                        depths.add(ancestors.depth());
                    }
                })
                .build());
        CheckRegistry registry = CheckRegistry.builder().register(counter).register(new BlockIdUsage()).build();

        CheckRunResult result = run(registry, List.of(
                new SourceFile("deep.liquid", deep),
                new SourceFile("b.liquid", BLOCK_ID_SOURCE)));

        assertThat(depths).hasSize(depth);
        assertThat(depths.get(depth - 1)).isEqualTo(1 + 2 * (depth - 1));
        assertThat(result.offensesFor("b.liquid")).extracting(Offense::checkCode).containsExactly("BlockIdUsage");
    }

    @Test
    @Tag("unit")
    void cancelledStageFailsOnlyItsHandler() {
        ICheckDefinition async = TestChecks.check("Async", context -> HandlerTable.builder()
                .onAsync(TextNode.class, (node, ancestors) -> {
                    CompletableFuture<Void> stage = new CompletableFuture<>();
                    stage.cancel(false);
                    return stage;
                })
                .build());
        CheckRegistry registry = CheckRegistry.builder().register(async).register(new BlockIdUsage()).build();

        CheckRunResult result = run(registry, List.of(new SourceFile("a.liquid", BLOCK_ID_SOURCE)));

        assertThat(result.offensesFor("a.liquid")).extracting(Offense::checkCode)
                .containsExactly("BlockIdUsage", "Async");
    }

    @Test
    @Tag("unit")
    void asynchronousHandlersCompleteBeforeDispatchReturns() {
        ICheckDefinition async = TestChecks.check("Async", context -> HandlerTable.builder()
                .onAsync(TextNode.class, (node, ancestors) -> CompletableFuture.runAsync(
                        () -> context.report("text found", node.position())))
                .build());

        CheckRunResult result = run(CheckRegistry.builder().register(async).build(),
                List.of(new SourceFile("a.liquid", "hello")));

        assertThat(result.offenses()).extracting(Offense::message).containsExactly("text found");
    }

    @Test
    @Tag("unit")
    void failedStageIsReportedWithItsCause() {
        ICheckDefinition async = TestChecks.check("Async", context -> HandlerTable.builder()
                .onAsync(TextNode.class, (node, ancestors) ->
                        CompletableFuture.failedFuture(new IllegalArgumentException("lookup failed")))
                .build());

        CheckRunResult result = run(CheckRegistry.builder().register(async).build(),
                List.of(new SourceFile("a.liquid", "hello")));

        assertThat(result.offenses()).singleElement()
                .extracting(Offense::message).isEqualTo("Internal error in check Async: lookup failed");
    }

    @Test
    @Tag("unit")
    void handlerTableKeysHandlersByNodeKind() {
        HandlerTable table = HandlerTable.builder()
                .on(TextNode.class, (node, ancestors) -> {})
                .on(TextNode.class, (node, ancestors) -> {})
                .build();

        assertThat(table.handlersFor(NodeKind.TEXT)).hasSize(2);
        assertThat(table.handlersFor(NodeKind.LIQUID_TAG)).isEmpty();
        assertThat(HandlerTable.empty().isEmpty()).isTrue();
    }
}
