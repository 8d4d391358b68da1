package com.rdparser.playground.parser;

/**
 * One entry of the parse trace.
 *
 * @param rule          production being applied
 * @param action        what the parser did
 * @param token         lookahead value when the step was logged
 * @param tokenType     lookahead type when the step was logged
 * @param depth         recursion depth of the nonterminal method
 * @param sequenceIndex position of the step in the trace
 */
public record Step(
        String rule,
        String action,
        String token,
        String tokenType,
        int depth,
        int sequenceIndex) {
}
