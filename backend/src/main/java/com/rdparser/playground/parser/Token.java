package com.rdparser.playground.parser;

/**
 * A lexeme of the expression. {@code start} is inclusive, {@code end} exclusive.
 */
public record Token(
        TokenType type,
        String value,
        int start,
        int end) {

    static final String EOF_VALUE = "EOF";

    static Token eof(int position) {
        return new Token(TokenType.EOF, EOF_VALUE, position, position);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }
}
