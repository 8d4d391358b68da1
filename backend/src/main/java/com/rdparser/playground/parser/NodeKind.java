package com.rdparser.playground.parser;

/**
 * Rendering category of a laid-out node, resolved in declaration order.
 */
public enum NodeKind {
    EPSILON,
    OPERATOR,
    TERMINAL,
    NONTERMINAL
}
