package org.themecheck.frontend.parser;

import org.themecheck.frontend.lexer.MarkupLexer;
import org.themecheck.frontend.lexer.Token;
import org.themecheck.frontend.lexer.TokenType;
import org.themecheck.frontend.parser.ast.AstNode;
import org.themecheck.frontend.parser.ast.Comparison;
import org.themecheck.frontend.parser.ast.LiquidFilter;
import org.themecheck.frontend.parser.ast.LiquidLiteral;
import org.themecheck.frontend.parser.ast.LiquidVariable;
import org.themecheck.frontend.parser.ast.LogicalExpression;
import org.themecheck.frontend.parser.ast.NamedArgument;
import org.themecheck.frontend.parser.ast.NumberLiteral;
import org.themecheck.frontend.parser.ast.Position;
import org.themecheck.frontend.parser.ast.StringLiteral;
import org.themecheck.frontend.parser.ast.VariableLookup;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser over the tokens of one tag's or output's markup.
 * Tag handlers use it to turn markup into expression nodes.
 */
public final class MarkupParser {

    private final String source;
    private final List<Token> tokens;
    private int current = 0;

    /**
     * @param source The whole file text.
     * @param start  The absolute offset where the markup starts.
     * @param end    The absolute offset one past the end of the markup.
     * @throws LiquidParseException if the markup cannot be tokenized.
     */
    public MarkupParser(String source, int start, int end) throws LiquidParseException {
        this.source = source;
        this.tokens = new MarkupLexer(source, start, end).tokenize();
    }

    /**
     * Parses {@code comparison (and|or condition)?}.
     */
    public AstNode parseCondition() throws LiquidParseException {
        AstNode left = parseComparison();
        if (peek().isWord("and") || peek().isWord("or")) {
            String relation = advance().text();
            AstNode right = parseCondition();
            return new LogicalExpression(relation, left, right, Position.spanning(left.position(), right.position()));
        }
        return left;
    }

    /**
     * Parses {@code expression (comparator expression)?}.
     */
    public AstNode parseComparison() throws LiquidParseException {
        AstNode left = parseExpression();
        if (check(TokenType.COMPARATOR) || peek().isWord("contains")) {
            String comparator = advance().text();
            AstNode right = parseExpression();
            return new Comparison(comparator, left, right, Position.spanning(left.position(), right.position()));
        }
        return left;
    }

    /**
     * Parses a single value: a string, a number, a literal keyword or a variable lookup.
     */
    public AstNode parseExpression() throws LiquidParseException {
        Token token = peek();
        switch (token.type()) {
            case STRING:
                advance();
                return new StringLiteral(token.text(),
                        source.charAt(token.position().start()) == '\'', token.position());
            case NUMBER:
                advance();
                return new NumberLiteral(token.text(), token.position());
            case IDENTIFIER:
                if (LiquidLiteral.KEYWORDS.contains(token.text())
                        && !check(1, TokenType.DOT) && !check(1, TokenType.LBRACKET)) {
                    advance();
                    return new LiquidLiteral(token.text(), token.position());
                }
                return parseLookup();
            case LBRACKET:
                return parseLookup();
            default:
                throw error("Expected an expression", token);
        }
    }

    /**
     * Parses an expression followed by its filters.
     */
    public LiquidVariable parseVariable() throws LiquidParseException {
        AstNode expression = parseExpression();
        List<LiquidFilter> filters = new ArrayList<>();
        Position last = expression.position();
        while (match(TokenType.PIPE)) {
            Token name = consume(TokenType.IDENTIFIER, "Expected a filter name after '|'");
            List<AstNode> arguments = new ArrayList<>();
            Position end = name.position();
            if (match(TokenType.COLON)) {
                do {
                    AstNode argument = parseArgument();
                    arguments.add(argument);
                    end = argument.position();
                } while (match(TokenType.COMMA));
            }
            LiquidFilter filter = new LiquidFilter(name.text(), arguments, Position.spanning(name.position(), end));
            filters.add(filter);
            last = filter.position();
        }
        return new LiquidVariable(expression, filters, Position.spanning(expression.position(), last));
    }

    /**
     * Parses {@code name: value} pairs separated by commas until the end of the markup.
     * A single leading comma is accepted.
     */
    public List<NamedArgument> parseNamedArguments() throws LiquidParseException {
        List<NamedArgument> arguments = new ArrayList<>();
        match(TokenType.COMMA);
        while (!isAtEnd()) {
            AstNode argument = parseArgument();
            if (!(argument instanceof NamedArgument named)) {
                throw error("Expected a named argument", peek());
            }
            arguments.add(named);
            if (!match(TokenType.COMMA)) break;
        }
        return arguments;
    }

    private AstNode parseArgument() throws LiquidParseException {
        if (check(TokenType.IDENTIFIER) && check(1, TokenType.COLON)) {
            Token name = advance();
            advance();
            AstNode value = parseExpression();
            return new NamedArgument(name.text(), value, Position.spanning(name.position(), value.position()));
        }
        return parseExpression();
    }

    private VariableLookup parseLookup() throws LiquidParseException {
        Token first = peek();
        String name = null;
        Position end = first.position();
        List<AstNode> lookups = new ArrayList<>();
        if (check(TokenType.IDENTIFIER)) {
            name = advance().text();
        }
        while (true) {
            if (match(TokenType.DOT)) {
                Token property = consume(TokenType.IDENTIFIER, "Expected a property name after '.'");
                lookups.add(new StringLiteral(property.text(), false, property.position()));
                end = property.position();
            } else if (match(TokenType.LBRACKET)) {
                lookups.add(parseExpression());
                end = consume(TokenType.RBRACKET, "Expected ']'").position();
            } else {
                break;
            }
        }
        return new VariableLookup(name, lookups, Position.spanning(first.position(), end));
    }

    /**
     * Consumes the current token if it has the given type.
     */
    public boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Consumes the current token if it is the identifier {@code word}.
     */
    public boolean matchWord(String word) {
        if (peek().isWord(word)) {
            advance();
            return true;
        }
        return false;
    }

    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean check(int lookahead, TokenType type) {
        int index = Math.min(current + lookahead, tokens.size() - 1);
        return tokens.get(index).type() == type;
    }

    public Token peek() {
        return tokens.get(current);
    }

    public Token advance() {
        Token token = tokens.get(current);
        if (token.type() != TokenType.EOF) current++;
        return token;
    }

    public Token consume(TokenType type, String errorMessage) throws LiquidParseException {
        if (check(type)) return advance();
        throw error(errorMessage, peek());
    }

    public boolean isAtEnd() {
        return check(TokenType.EOF);
    }

    /**
     * Fails unless all tokens have been consumed.
     */
    public void expectEnd() throws LiquidParseException {
        if (!isAtEnd()) {
            throw error("Unexpected '" + peek().text() + "'", peek());
        }
    }

    private static LiquidParseException error(String message, Token token) {
        return new LiquidParseException(message, token.position());
    }
}
