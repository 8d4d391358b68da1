package com.rdparser.playground.parser;

/**
 * Result of a single nonterminal method: either a value or the error that
 * stopped the descent.
 */
record Outcome<T>(T value, ParseError error) {

    static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null);
    }

    static <T> Outcome<T> failure(ParseError error) {
        return new Outcome<>(null, error);
    }

    boolean isFailure() {
        return error != null;
    }
}
