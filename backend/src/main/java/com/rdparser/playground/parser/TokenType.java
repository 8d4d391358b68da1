package com.rdparser.playground.parser;

public enum TokenType {
    NUMBER("Number"),
    ID("Identifier"),
    PLUS("Plus (+)"),
    MINUS("Minus (−)"),
    STAR("Multiply (×)"),
    SLASH("Divide (÷)"),
    LPAREN("Left Paren"),
    RPAREN("Right Paren"),
    EOF("End of Input");

    private final String label;

    TokenType(String label) {
        this.label = label;
    }

    /**
     * Human-readable name shown next to tokens in the token table.
     */
    public String label() {
        return label;
    }

    static TokenType forSymbol(char ch) {
        switch (ch) {
            case '+':
                return PLUS;
            case '-':
                return MINUS;
            case '*':
                return STAR;
            case '/':
                return SLASH;
            case '(':
                return LPAREN;
            case ')':
                return RPAREN;
            default:
                return null;
        }
    }
}
