package org.themecheck.frontend.lexer;

/**
 * Token types of Liquid tag and output markup.
 */
public enum TokenType {
    IDENTIFIER,
    STRING,
    NUMBER,
    COMPARATOR,
    DOT,
    DOTDOT,
    COMMA,
    COLON,
    PIPE,
    LBRACKET,
    RBRACKET,
    LPAREN,
    RPAREN,
    EOF
}
