package org.themecheck.frontend.parser;

import org.themecheck.frontend.lexer.LiquidTokenizer;
import org.themecheck.frontend.lexer.Segment;
import org.themecheck.frontend.parser.ast.AstNode;
import org.themecheck.frontend.parser.ast.DocumentNode;
import org.themecheck.frontend.parser.ast.LiquidBranch;
import org.themecheck.frontend.parser.ast.LiquidTag;
import org.themecheck.frontend.parser.ast.LiquidVariable;
import org.themecheck.frontend.parser.ast.LiquidVariableOutput;
import org.themecheck.frontend.parser.ast.Position;
import org.themecheck.frontend.parser.ast.TextNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link DocumentNode} from Liquid source. Segments come from the {@link LiquidTokenizer};
 * block tags are matched against their {@code end} tags with an explicit stack and tag markup is parsed
 * by the handlers of a {@link LiquidTagRegistry}.
 */
public class LiquidParser implements ILiquidParser {

    private static final String LIQUID_TAG = "liquid";

    /** Block tags whose body is split into branches. */
    private static final Set<String> BRANCHING_TAGS = Set.of("if", "unless", "case", "for", "tablerow");

    /** Block tags with a plain body. */
    private static final Set<String> BODY_TAGS = Set.of(
            "capture", "form", "paginate", "raw", "comment", "doc", "schema", "javascript", "style", "stylesheet");

    /** Branch tag name to the block tags that accept it. */
    private static final Map<String, Set<String>> BRANCH_PARENTS = Map.of(
            "elsif", Set.of("if", "unless"),
            "when", Set.of("case"),
            "else", Set.of("if", "unless", "case", "for", "tablerow"));

    private final LiquidTagRegistry tagRegistry;

    public LiquidParser() {
        this(LiquidTagRegistry.initialize());
    }

    public LiquidParser(LiquidTagRegistry tagRegistry) {
        this.tagRegistry = tagRegistry;
    }

    @Override
    public DocumentNode parse(String source) throws LiquidParseException {
        LiquidTokenizer tokenizer = new LiquidTokenizer(source);
        List<Segment> segments = tokenizer.tokenize();
        Deque<BlockFrame> stack = new ArrayDeque<>();
        BlockFrame root = new BlockFrame(null, List.of(), false);
        stack.push(root);

        for (Segment segment : segments) {
            BlockFrame top = stack.peek();
            switch (segment.type()) {
                case TEXT -> top.target().add(new TextNode(segment.markup(), segment.position()));
                case OUTPUT -> top.target().add(output(source, segment));
                case TAG -> {
                    if (LIQUID_TAG.equals(segment.name())) {
                        liquidTag(source, tokenizer, segment, stack);
                    } else {
                        handleTag(source, segment, stack);
                    }
                }
            }
        }

        if (stack.size() > 1) {
            Segment unclosed = stack.peek().open;
            throw new LiquidParseException("Unclosed tag '" + unclosed.name() + "'", unclosed.position());
        }
        return new DocumentNode(root.body, new Position(0, source.length()));
    }

    /**
     * Parses each line of a {@code liquid} tag as a tag of its own. Blocks opened inside the tag must be
     * closed inside it.
     */
    private void liquidTag(String source, LiquidTokenizer tokenizer, Segment segment, Deque<BlockFrame> stack)
            throws LiquidParseException {
        BlockFrame frame = new BlockFrame(segment, List.of(), false);
        stack.push(frame);
        for (Segment line : tokenizer.tokenizeLiquidTag(segment)) {
            if (LIQUID_TAG.equals(line.name()) || ("end" + LIQUID_TAG).equals(line.name())) {
                throw new LiquidParseException("Unexpected '" + line.name() + "' inside 'liquid'", line.position());
            }
            handleTag(source, line, stack);
        }
        if (stack.peek() != frame) {
            Segment unclosed = stack.peek().open;
            throw new LiquidParseException("Unclosed tag '" + unclosed.name() + "'", unclosed.position());
        }
        stack.pop();
        stack.peek().target().add(new LiquidTag(LIQUID_TAG, segment.markup(), List.of(), frame.body,
                segment.position(), segment.position()));
    }

    private void handleTag(String source, Segment segment, Deque<BlockFrame> stack) throws LiquidParseException {
        String name = segment.name();
        BlockFrame top = stack.peek();

        if (name.startsWith("end") && name.length() > 3) {
            String blockName = name.substring(3);
            if (top.open == null || !top.open.name().equals(blockName)) {
                throw new LiquidParseException("Unexpected '" + name + "'", segment.position());
            }
            stack.pop();
            top.closeBranch(segment.position().start());
            stack.peek().target().add(new LiquidTag(
                    blockName,
                    top.open.markup(),
                    top.markupNodes,
                    top.branching ? top.branches : top.body,
                    new Position(top.open.position().start(), segment.position().end()),
                    top.open.position()));
            return;
        }

        Set<String> branchParents = BRANCH_PARENTS.get(name);
        if (branchParents != null) {
            if (top.open == null || !branchParents.contains(top.open.name())) {
                throw new LiquidParseException("Unexpected '" + name + "'", segment.position());
            }
            top.closeBranch(segment.position().start());
            top.openBranch(name, segment, parseMarkup(source, segment));
            return;
        }

        List<AstNode> markupNodes = parseMarkup(source, segment);
        if (BRANCHING_TAGS.contains(name)) {
            BlockFrame frame = new BlockFrame(segment, markupNodes, true);
            frame.openDefaultBranch();
            stack.push(frame);
        } else if (BODY_TAGS.contains(name)) {
            stack.push(new BlockFrame(segment, markupNodes, false));
        } else {
            top.target().add(new LiquidTag(name, segment.markup(), markupNodes, List.of(),
                    segment.position(), segment.position()));
        }
    }

    private List<AstNode> parseMarkup(String source, Segment segment) throws LiquidParseException {
        Optional<ILiquidTagHandler> handler = tagRegistry.get(segment.name());
        if (handler.isEmpty()) {
            return List.of();
        }
        MarkupParser parser = new MarkupParser(source, segment.markupStart(), segment.markupEnd());
        return handler.get().parseMarkup(parser);
    }

    private LiquidVariableOutput output(String source, Segment segment) throws LiquidParseException {
        if (segment.markup().isEmpty()) {
            return new LiquidVariableOutput("", null, segment.position());
        }
        MarkupParser parser = new MarkupParser(source, segment.markupStart(), segment.markupEnd());
        LiquidVariable variable = parser.parseVariable();
        parser.expectEnd();
        return new LiquidVariableOutput(segment.markup(), variable, segment.position());
    }

    /**
     * An open block tag on the parser stack. The root frame has no opening segment.
     */
    private static final class BlockFrame {
        final Segment open;
        final List<AstNode> markupNodes;
        final boolean branching;
        final List<AstNode> body = new ArrayList<>();
        final List<AstNode> branches = new ArrayList<>();

        private String branchName;
        private String branchMarkup;
        private List<AstNode> branchMarkupNodes;
        private List<AstNode> branchChildren;
        private int branchStart;

        BlockFrame(Segment open, List<AstNode> markupNodes, boolean branching) {
            this.open = open;
            this.markupNodes = markupNodes;
            this.branching = branching;
        }

        List<AstNode> target() {
            return branchChildren != null ? branchChildren : body;
        }

        void openDefaultBranch() {
            branchName = null;
            branchMarkup = "";
            branchMarkupNodes = List.of();
            branchChildren = new ArrayList<>();
            branchStart = open.position().end();
        }

        void openBranch(String name, Segment segment, List<AstNode> markupNodes) {
            branchName = name;
            branchMarkup = segment.markup();
            branchMarkupNodes = markupNodes;
            branchChildren = new ArrayList<>();
            branchStart = segment.position().start();
        }

        void closeBranch(int end) {
            if (branchChildren == null) return;
            branches.add(new LiquidBranch(branchName, branchMarkup, branchMarkupNodes, branchChildren,
                    new Position(branchStart, end)));
            branchChildren = null;
        }
    }
}
