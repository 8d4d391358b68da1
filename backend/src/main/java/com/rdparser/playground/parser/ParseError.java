package com.rdparser.playground.parser;

/**
 * Syntax error raised by the parser. {@code position} is -1 when the
 * offending token has no location.
 */
public record ParseError(
        String message,
        int position,
        ErrorKind kind) {
}
