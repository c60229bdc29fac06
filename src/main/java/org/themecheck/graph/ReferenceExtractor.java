package org.themecheck.graph;

import org.themecheck.frontend.parser.ast.AstNode;
import org.themecheck.frontend.parser.ast.DocumentNode;
import org.themecheck.frontend.parser.ast.LiquidFilter;
import org.themecheck.frontend.parser.ast.LiquidTag;
import org.themecheck.frontend.parser.ast.LiquidVariable;
import org.themecheck.frontend.parser.ast.NamedArgument;
import org.themecheck.frontend.parser.ast.Position;
import org.themecheck.frontend.parser.ast.RenderMarkup;
import org.themecheck.frontend.parser.ast.StringLiteral;
import org.themecheck.frontend.parser.ast.VariableLookup;
import org.themecheck.frontend.traversal.AstTraversal;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the module references of a parsed Liquid file:
 * <ul>
 *   <li>{@code render} and {@code include} reference snippets</li>
 *   <li>{@code section} references a section, {@code sections} a section group</li>
 *   <li>{@code content_for 'block', type: 'x'} references a theme block</li>
 *   <li>{@code layout 'x'} references a layout; {@code layout none} references nothing</li>
 *   <li>a string piped into {@code asset_url} references an asset</li>
 * </ul>
 */
final class ReferenceExtractor {

    private ReferenceExtractor() {}

    static List<ExtractedReference> extract(DocumentNode document, String source) {
        List<ExtractedReference> references = new ArrayList<>();
        AstTraversal.walk(document, (node, ancestors) -> {
            if (node instanceof LiquidTag tag) {
                visitTag(tag, source, references);
            } else if (node instanceof LiquidVariable variable) {
                visitVariable(variable, source, references);
            }
        });
        return references;
    }

    private static void visitTag(LiquidTag tag, String source, List<ExtractedReference> out) {
        if (tag.markupNodes().isEmpty()) return;
        AstNode first = tag.markupNodes().get(0);
        switch (tag.name()) {
            case "render", "include" -> {
                if (first instanceof RenderMarkup markup) {
                    add(out, tag.name(), LiquidModuleKind.SNIPPET, markup.snippet(), source);
                }
            }
            case "section" -> add(out, tag.name(), LiquidModuleKind.SECTION, first, source);
            case "sections" -> {
                if (first instanceof StringLiteral group) {
                    out.add(new ExtractedReference(tag.name(), LiquidModuleKind.SECTION,
                            LiquidModuleKind.SECTION.pathFor(group.value() + ".json"),
                            text(source, group.position()), group.position()));
                } else {
                    add(out, tag.name(), LiquidModuleKind.SECTION, first, source);
                }
            }
            case "layout" -> {
                if (first instanceof VariableLookup lookup && "none".equals(lookup.name()) && lookup.lookups().isEmpty()) {
                    return;
                }
                add(out, tag.name(), LiquidModuleKind.LAYOUT, first, source);
            }
            case "content_for" -> {
                if (!(first instanceof StringLiteral contentType) || !contentType.value().equals("block")) return;
                for (AstNode node : tag.markupNodes()) {
                    if (node instanceof NamedArgument argument && argument.name().equals("type")) {
                        if (argument.value() instanceof StringLiteral type && type.value().startsWith("@")) return;
                        add(out, tag.name(), LiquidModuleKind.BLOCK, argument.value(), source);
                    }
                }
            }
            default -> {
            }
        }
    }

    private static void visitVariable(LiquidVariable variable, String source, List<ExtractedReference> out) {
        if (variable.filters().isEmpty()) return;
        LiquidFilter filter = variable.filters().get(0);
        if (filter.name().equals("asset_url")) {
            add(out, filter.name(), LiquidModuleKind.ASSET, variable.expression(), source);
        }
    }

    private static void add(List<ExtractedReference> out, String tagName, LiquidModuleKind kind,
                            AstNode target, String source) {
        String expression = text(source, target.position());
        if (target instanceof StringLiteral literal) {
            out.add(new ExtractedReference(tagName, kind, kind.pathFor(literal.value()), expression, target.position()));
        } else {
            out.add(new ExtractedReference(tagName, kind, null, expression, target.position()));
        }
    }

    private static String text(String source, Position position) {
        return source.substring(position.start(), Math.min(position.end(), source.length()));
    }
}
