package com.rdparser.playground.parser;

import java.util.List;

public record TokenizeResult(
        List<Token> tokens,
        String error,
        Integer errorPos) {

    public static TokenizeResult success(List<Token> tokens) {
        return new TokenizeResult(List.copyOf(tokens), null, null);
    }

    public static TokenizeResult error(String error, int errorPos) {
        return new TokenizeResult(List.of(), error, errorPos);
    }

    public boolean hasError() {
        return error != null;
    }
}
