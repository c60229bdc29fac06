package org.themecheck.checks.rules;

import org.themecheck.checks.CheckContext;
import org.themecheck.checks.CheckDocs;
import org.themecheck.checks.CheckMeta;
import org.themecheck.checks.CheckSchema;
import org.themecheck.checks.HandlerTable;
import org.themecheck.checks.ICheckDefinition;
import org.themecheck.checks.Severity;
import org.themecheck.frontend.parser.ast.Comparison;
import org.themecheck.frontend.parser.ast.LiquidTag;
import org.themecheck.frontend.parser.ast.StringLiteral;
import org.themecheck.frontend.parser.ast.VariableLookup;

/**
 * Reports conditions that compare {@code block.id} to a value.
 *
 * <p>Reported:
 * <ul>
 *   <li>{@code {% if block.id == "123" %}}, likewise in {@code elsif} and {@code unless}</li>
 *   <li>{@code {% case block.id %}}</li>
 * </ul>
 * Not reported: outputting the id, e.g. {@code data-block-id="{{ block.id }}"}.
 */
public final class BlockIdUsage implements ICheckDefinition {

    public static final String CODE = "BlockIdUsage";

    public static final String MESSAGE = "The ID is dynamically generated by Shopify and is subject to change. "
            + "You should avoid relying on a literal value of this ID.";

    private static final CheckMeta META = new CheckMeta(
            CODE,
            "Do not rely on `block.id` in if/else/unless/case",
            new CheckDocs(MESSAGE,
                    "https://shopify.dev/docs/storefronts/themes/tools/theme-check/checks/block_id_usage",
                    true),
            Severity.WARNING,
            CheckSchema.empty());

    @Override
    public CheckMeta meta() {
        return META;
    }

    @Override
    public HandlerTable create(CheckContext context) {
        return HandlerTable.builder()
                .on(Comparison.class, (node, ancestors) -> {
                    if (node.comparator().equals("==")
                            && node.left() instanceof VariableLookup lookup
                            && isUsingBlockId(lookup)) {
                        context.report(MESSAGE, node.position());
                    }
                })
                .on(VariableLookup.class, (node, ancestors) -> {
                    boolean inCase = ancestors.parent()
                            .filter(parent -> parent instanceof LiquidTag tag && tag.name().equals("case"))
                            .isPresent();
                    if (inCase && isUsingBlockId(node)) {
                        context.report(MESSAGE, node.position());
                    }
                })
                .build();
    }

    private static boolean isUsingBlockId(VariableLookup lookup) {
        return "block".equals(lookup.name())
                && !lookup.lookups().isEmpty()
                && lookup.lookups().get(0) instanceof StringLiteral property
                && property.value().equals("id");
    }
}
