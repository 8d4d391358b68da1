package com.rdparser.playground.dto;

import com.rdparser.playground.parser.Token;

public record TokenView(
        String type,
        String typeLabel,
        String value,
        int start,
        int end) {

    public static TokenView of(Token token) {
        return new TokenView(
                token.type().name(),
                token.type().label(),
                token.value(),
                token.start(),
                token.end());
    }
}
