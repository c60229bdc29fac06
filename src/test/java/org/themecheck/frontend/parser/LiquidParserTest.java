package org.themecheck.frontend.parser;

import org.themecheck.frontend.parser.ast.AstNode;
import org.themecheck.frontend.parser.ast.Comparison;
import org.themecheck.frontend.parser.ast.DocumentNode;
import org.themecheck.frontend.parser.ast.LiquidBranch;
import org.themecheck.frontend.parser.ast.LiquidFilter;
import org.themecheck.frontend.parser.ast.LiquidTag;
import org.themecheck.frontend.parser.ast.LiquidVariableOutput;
import org.themecheck.frontend.parser.ast.LogicalExpression;
import org.themecheck.frontend.parser.ast.NamedArgument;
import org.themecheck.frontend.parser.ast.Position;
import org.themecheck.frontend.parser.ast.RenderMarkup;
import org.themecheck.frontend.parser.ast.StringLiteral;
import org.themecheck.frontend.parser.ast.TextNode;
import org.themecheck.frontend.parser.ast.VariableLookup;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests building syntax trees from Liquid source.
 */
public class LiquidParserTest {

    private final LiquidParser parser = new LiquidParser();

    @Test
    @Tag("unit")
    void ifTagOwnsItsBranches() throws Exception {
        String source = "{% if a %}x{% elsif b %}y{% else %}z{% endif %}";
        DocumentNode document = parser.parse(source);

        assertThat(document.getChildren()).hasSize(1);
        LiquidTag tag = (LiquidTag) document.getChildren().get(0);
        assertThat(tag.name()).isEqualTo("if");
        assertThat(tag.isBlock()).isTrue();
        assertThat(tag.position()).isEqualTo(new Position(0, source.length()));
        assertThat(tag.children()).hasSize(3);

        LiquidBranch first = (LiquidBranch) tag.children().get(0);
        LiquidBranch second = (LiquidBranch) tag.children().get(1);
        LiquidBranch third = (LiquidBranch) tag.children().get(2);
        assertThat(first.isDefault()).isTrue();
        assertThat(((TextNode) first.children().get(0)).value()).isEqualTo("x");
        assertThat(second.name()).isEqualTo("elsif");
        assertThat(second.markupNodes()).singleElement().isInstanceOf(VariableLookup.class);
        assertThat(third.name()).isEqualTo("else");
    }

    @Test
    @Tag("unit")
    void conditionsParseIntoComparisonsAndLogicalExpressions() throws Exception {
        String source = "{% if block.id == '123' and x %}{% endif %}";
        LiquidTag tag = (LiquidTag) parser.parse(source).getChildren().get(0);

        LogicalExpression condition = (LogicalExpression) tag.markupNodes().get(0);
        assertThat(condition.relation()).isEqualTo("and");
        Comparison comparison = (Comparison) condition.left();
        assertThat(comparison.comparator()).isEqualTo("==");
        assertThat(text(source, comparison)).isEqualTo("block.id == '123'");
        VariableLookup lookup = (VariableLookup) comparison.left();
        assertThat(lookup.name()).isEqualTo("block");
        assertThat(lookup.lookups()).singleElement()
                .isEqualTo(new StringLiteral("id", false, new Position(12, 14)));
    }

    @Test
    @Tag("unit")
    void renderMarkupCarriesTargetAndArguments() throws Exception {
        String source = "{% render 'price', product: product %}";
        LiquidTag tag = (LiquidTag) parser.parse(source).getChildren().get(0);

        RenderMarkup markup = (RenderMarkup) tag.markupNodes().get(0);
        StringLiteral snippet = (StringLiteral) markup.snippet();
        assertThat(snippet.value()).isEqualTo("price");
        assertThat(snippet.singleQuoted()).isTrue();
        assertThat(text(source, snippet)).isEqualTo("'price'");
        assertThat(markup.arguments()).extracting(NamedArgument::name).containsExactly("product");
        assertThat(tag.isBlock()).isFalse();
    }

    @Test
    @Tag("unit")
    void outputsParseFilters() throws Exception {
        String source = "<link href=\"{{ 'theme.css' | asset_url }}\">";
        AstNode node = parser.parse(source).getChildren().get(1);

        LiquidVariableOutput output = (LiquidVariableOutput) node;
        assertThat(output.variable().expression()).isInstanceOf(StringLiteral.class);
        assertThat(output.variable().filters()).extracting(LiquidFilter::name).containsExactly("asset_url");
    }

    @Test
    @Tag("unit")
    void caseTagKeepsSubjectInMarkupAndWhenInBranches() throws Exception {
        String source = "{% case block.id %}{% when '1', '2' %}one{% else %}other{% endcase %}";
        LiquidTag tag = (LiquidTag) parser.parse(source).getChildren().get(0);

        assertThat(tag.markupNodes()).singleElement().isInstanceOf(VariableLookup.class);
        assertThat(tag.children()).extracting(child -> ((LiquidBranch) child).name())
                .containsExactly(null, "when", "else");
        assertThat(((LiquidBranch) tag.children().get(1)).markupNodes()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void liquidTagLinesBecomeChildTags() throws Exception {
        String source = "{%- liquid\n  assign x = 1\n  # note\n  if a\n    render 'card'\n  endif\n-%}";
        DocumentNode document = parser.parse(source);

        LiquidTag liquid = (LiquidTag) document.getChildren().get(0);
        assertThat(liquid.name()).isEqualTo("liquid");
        assertThat(liquid.position()).isEqualTo(new Position(0, source.length()));
        assertThat(liquid.children()).extracting(node -> ((LiquidTag) node).name()).containsExactly("assign", "if");

        LiquidTag ifTag = (LiquidTag) liquid.children().get(1);
        assertThat(text(source, ifTag)).isEqualTo("if a\n    render 'card'\n  endif");
        LiquidTag render = (LiquidTag) ((LiquidBranch) ifTag.children().get(0)).children().get(0);
        assertThat(text(source, render)).isEqualTo("render 'card'");
        RenderMarkup markup = (RenderMarkup) render.markupNodes().get(0);
        assertThat(text(source, markup.snippet())).isEqualTo("'card'");
    }

    @Test
    @Tag("unit")
    void liquidTagSkipsOpaqueBodiesAndRejectsUnclosedBlocks() throws Exception {
        String source = "{% liquid\n comment\n render 'hidden'\n endcomment\n echo 'x'\n%}";
        LiquidTag liquid = (LiquidTag) parser.parse(source).getChildren().get(0);

        assertThat(liquid.children()).extracting(node -> ((LiquidTag) node).name()).containsExactly("comment", "echo");
        assertThat(((LiquidTag) liquid.children().get(0)).children()).isEmpty();

        assertThatThrownBy(() -> parser.parse("{% liquid\n if a\n echo 'x'\n%}{% endif %}"))
                .isInstanceOf(LiquidParseException.class)
                .hasMessageContaining("Unclosed tag 'if'");
    }

    @Test
    @Tag("unit")
    void mismatchedAndUnclosedTagsAreRejected() {
        assertThatThrownBy(() -> parser.parse("{% if a %}x"))
                .isInstanceOf(LiquidParseException.class)
                .hasMessageContaining("Unclosed tag 'if'");
        assertThatThrownBy(() -> parser.parse("{% endif %}"))
                .isInstanceOf(LiquidParseException.class)
                .hasMessageContaining("Unexpected 'endif'");
        assertThatThrownBy(() -> parser.parse("{% for x in y %}{% elsif a %}{% endfor %}"))
                .isInstanceOf(LiquidParseException.class);
    }

    @Test
    @Tag("unit")
    void parseErrorsCarryPositionOfOffendingTag() {
        String source = "ok {% if a %}";
        assertThatThrownBy(() -> parser.parse(source))
                .isInstanceOfSatisfying(LiquidParseException.class,
                        e -> assertThat(e.getPosition()).isEqualTo(new Position(3, source.length())));
    }

    private static String text(String source, AstNode node) {
        return source.substring(node.position().start(), node.position().end());
    }
}
