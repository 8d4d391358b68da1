package com.rdparser.playground.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Scratch state of a single parse call. Created fresh by {@link Parser#parse(List)}
 * and never shared between calls.
 */
final class ParseContext {

    private static final Token MISSING = new Token(TokenType.EOF, Token.EOF_VALUE, -1, -1);

    private final List<Token> tokens;
    private final List<Step> steps = new ArrayList<>();
    private final List<ParseTreeNode> arena = new ArrayList<>();
    private int index;
    private int depth;

    ParseContext(List<Token> tokens) {
        this.tokens = tokens != null ? tokens : List.of();
    }

    Token peek() {
        return index < tokens.size() ? tokens.get(index) : MISSING;
    }

    Token consume() {
        Token token = peek();
        index++;
        return token;
    }

    void descend() {
        depth++;
    }

    void ascend() {
        depth--;
    }

    void log(String rule, String action) {
        Token lookahead = peek();
        steps.add(new Step(rule, action, lookahead.value(), lookahead.type().name(), depth, steps.size()));
    }

    ParseTreeNode node(String label, ParseTreeNode... children) {
        ParseTreeNode node = new ParseTreeNode(arena.size(), label, List.of(children));
        arena.add(node);
        return node;
    }

    /**
     * Records the failure step for the current lookahead and returns the error
     * to be propagated up the descent.
     */
    <T> Outcome<T> fail(String expected, ErrorKind kind) {
        Token token = peek();
        String location = token.start() >= 0 ? " at position " + token.start() : "";
        String found = token.is(TokenType.EOF) ? "end of input" : "'" + token.value() + "'";
        String message = "Syntax Error" + location + ": Expected " + expected + ", but found " + found;

        log(Parser.FAILURE_RULE, message);
        return Outcome.failure(new ParseError(message, token.start(), kind));
    }

    List<Step> steps() {
        return steps;
    }

    List<ParseTreeNode> arena() {
        return arena;
    }
}
