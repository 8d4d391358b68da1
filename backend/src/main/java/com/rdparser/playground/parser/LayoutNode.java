package com.rdparser.playground.parser;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LayoutNode(
        int id,
        String label,
        double x,
        double y,
        int depth,
        @JsonProperty("isLeaf") boolean leaf,
        @JsonProperty("isEpsilon") boolean epsilon,
        @JsonProperty("isOperator") boolean operator,
        @JsonProperty("isNonTerminal") boolean nonTerminal,
        NodeKind kind) {
}
