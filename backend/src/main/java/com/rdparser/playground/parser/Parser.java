package com.rdparser.playground.parser;

import java.util.List;
import java.util.function.Function;

/**
 * Recursive descent parser for the LL(1) arithmetic grammar:
 *
 * <pre>
 *   E  → T E'
 *   E' → + T E' | - T E' | ε
 *   T  → F T'
 *   T' → * F T' | / F T' | ε
 *   F  → ( E ) | id | number
 * </pre>
 *
 * <p>Each nonterminal has one method that picks its production from the
 * lookahead token alone. Syntax errors travel back up as failed
 * {@link Outcome}s; the first one aborts the descent.
 */
public final class Parser {

    public static final String EPSILON = "ε";

    static final String SUCCESS_RULE = "✓ Parse Complete";
    static final String FAILURE_RULE = "✗ Parse Error";

    private static final String E_RULE = "E → T E'";
    private static final String T_RULE = "T → F T'";
    private static final String GROUP_RULE = "F → ( E )";
    private static final String EPSILON_ACTION = "Epsilon (no match needed)";

    private Parser() {
    }

    public static ParseResult parse(List<Token> tokens) {
        ParseContext ctx = new ParseContext(tokens);

        Outcome<ParseTreeNode> expression = parseE(ctx);
        if (expression.isFailure()) {
            return ParseResult.failure(ctx.steps(), expression.error());
        }

        if (!ctx.peek().is(TokenType.EOF)) {
            Outcome<ParseTreeNode> trailing = ctx.fail("end of expression", ErrorKind.TRAILING_INPUT);
            return ParseResult.failure(ctx.steps(), trailing.error());
        }

        ctx.log(SUCCESS_RULE, "Expression parsed successfully!");
        return ParseResult.success(expression.value(), ctx.arena(), ctx.steps());
    }

    // E → T E'
    private static Outcome<ParseTreeNode> parseE(ParseContext ctx) {
        ctx.descend();
        try {
            ctx.log(E_RULE, "Enter E");

            Outcome<ParseTreeNode> term = parseT(ctx);
            if (term.isFailure()) {
                return term;
            }
            Outcome<ParseTreeNode> rest = parseEPrime(ctx);
            if (rest.isFailure()) {
                return rest;
            }

            ParseTreeNode node = ctx.node("E", term.value(), rest.value());
            ctx.log(E_RULE, "Exit E");
            return Outcome.success(node);
        } finally {
            ctx.ascend();
        }
    }

    // E' → + T E' | - T E' | ε
    private static Outcome<ParseTreeNode> parseEPrime(ParseContext ctx) {
        ctx.descend();
        try {
            Token lookahead = ctx.peek();
            if (lookahead.is(TokenType.PLUS)) {
                return parseTail(ctx, "E'", "E' → + T E'", Parser::parseT, Parser::parseEPrime);
            }
            if (lookahead.is(TokenType.MINUS)) {
                return parseTail(ctx, "E'", "E' → - T E'", Parser::parseT, Parser::parseEPrime);
            }
            return parseEpsilon(ctx, "E'", "E' → ε");
        } finally {
            ctx.ascend();
        }
    }

    // T → F T'
    private static Outcome<ParseTreeNode> parseT(ParseContext ctx) {
        ctx.descend();
        try {
            ctx.log(T_RULE, "Enter T");

            Outcome<ParseTreeNode> factor = parseF(ctx);
            if (factor.isFailure()) {
                return factor;
            }
            Outcome<ParseTreeNode> rest = parseTPrime(ctx);
            if (rest.isFailure()) {
                return rest;
            }

            ParseTreeNode node = ctx.node("T", factor.value(), rest.value());
            ctx.log(T_RULE, "Exit T");
            return Outcome.success(node);
        } finally {
            ctx.ascend();
        }
    }

    // T' → * F T' | / F T' | ε
    private static Outcome<ParseTreeNode> parseTPrime(ParseContext ctx) {
        ctx.descend();
        try {
            Token lookahead = ctx.peek();
            if (lookahead.is(TokenType.STAR)) {
                return parseTail(ctx, "T'", "T' → * F T'", Parser::parseF, Parser::parseTPrime);
            }
            if (lookahead.is(TokenType.SLASH)) {
                return parseTail(ctx, "T'", "T' → / F T'", Parser::parseF, Parser::parseTPrime);
            }
            return parseEpsilon(ctx, "T'", "T' → ε");
        } finally {
            ctx.ascend();
        }
    }

    // F → ( E ) | id | number
    private static Outcome<ParseTreeNode> parseF(ParseContext ctx) {
        ctx.descend();
        try {
            Token lookahead = ctx.peek();

            if (lookahead.is(TokenType.LPAREN)) {
                ctx.log(GROUP_RULE, "Match '('");
                ctx.consume();
                ParseTreeNode open = ctx.node("(");

                Outcome<ParseTreeNode> inner = parseE(ctx);
                if (inner.isFailure()) {
                    return inner;
                }

                if (!ctx.peek().is(TokenType.RPAREN)) {
                    return ctx.fail("')'", ErrorKind.UNEXPECTED_TOKEN);
                }
                ctx.log(GROUP_RULE, "Match ')'");
                ctx.consume();
                ParseTreeNode close = ctx.node(")");

                return Outcome.success(ctx.node("F", open, inner.value(), close));
            }

            if (lookahead.is(TokenType.NUMBER)) {
                ctx.log("F → number", "Match number '" + lookahead.value() + "'");
                ctx.consume();
                return Outcome.success(ctx.node("F", ctx.node(lookahead.value())));
            }

            if (lookahead.is(TokenType.ID)) {
                ctx.log("F → id", "Match identifier '" + lookahead.value() + "'");
                ctx.consume();
                return Outcome.success(ctx.node("F", ctx.node(lookahead.value())));
            }

            return ctx.fail("number, identifier, or \"(\"", ErrorKind.UNEXPECTED_TOKEN);
        } finally {
            ctx.ascend();
        }
    }

    /**
     * Applies {@code X' → op operand X'} for the operator under the lookahead.
     */
    private static Outcome<ParseTreeNode> parseTail(ParseContext ctx, String nonTerminal, String rule,
            Function<ParseContext, Outcome<ParseTreeNode>> operand,
            Function<ParseContext, Outcome<ParseTreeNode>> tail) {
        Token operator = ctx.peek();
        ctx.log(rule, "Match '" + operator.value() + "'");
        ctx.consume();
        ParseTreeNode operatorNode = ctx.node(operator.value());

        Outcome<ParseTreeNode> right = operand.apply(ctx);
        if (right.isFailure()) {
            return right;
        }
        Outcome<ParseTreeNode> rest = tail.apply(ctx);
        if (rest.isFailure()) {
            return rest;
        }

        return Outcome.success(ctx.node(nonTerminal, operatorNode, right.value(), rest.value()));
    }

    private static Outcome<ParseTreeNode> parseEpsilon(ParseContext ctx, String nonTerminal, String rule) {
        ctx.log(rule, EPSILON_ACTION);
        return Outcome.success(ctx.node(nonTerminal, ctx.node(EPSILON)));
    }
}
