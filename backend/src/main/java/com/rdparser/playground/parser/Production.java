package com.rdparser.playground.parser;

public record Production(
        String lhs,
        String rhs,
        String description) {

    /**
     * Whether a trace step's rule was produced while expanding this
     * production's nonterminal, e.g. {@code "E' → ε"} belongs to {@code E'}
     * but not to {@code E}.
     */
    public boolean matchesRule(String stepRule) {
        if (stepRule == null) {
            return false;
        }
        int arrow = stepRule.indexOf('→');
        if (arrow < 0) {
            return false;
        }
        return stepRule.substring(0, arrow).trim().equals(lhs);
    }
}
