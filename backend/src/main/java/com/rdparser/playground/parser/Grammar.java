package com.rdparser.playground.parser;

import java.util.List;
import java.util.Optional;

/**
 * The grammar the parser implements, for display alongside the trace.
 */
public final class Grammar {

    private static final List<Production> PRODUCTIONS = List.of(
            new Production("E", "T E'", "Expression = Term followed by Expression-prime"),
            new Production("E'", "+ T E' | - T E' | ε", "Addition or subtraction (or nothing)"),
            new Production("T", "F T'", "Term = Factor followed by Term-prime"),
            new Production("T'", "* F T' | / F T' | ε", "Multiplication or division (or nothing)"),
            new Production("F", "( E ) | id | number", "Factor = parenthesized expr, identifier, or number"));

    private Grammar() {
    }

    public static List<Production> productions() {
        return PRODUCTIONS;
    }

    static Optional<Production> productionFor(Step step) {
        return PRODUCTIONS.stream()
                .filter(production -> production.matchesRule(step.rule()))
                .findFirst();
    }
}
