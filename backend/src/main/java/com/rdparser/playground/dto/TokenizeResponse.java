package com.rdparser.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenizeResponse(
        boolean success,
        List<TokenView> tokens,
        String error,
        Integer errorPos) {

    public static TokenizeResponse success(List<TokenView> tokens) {
        return new TokenizeResponse(true, tokens, null, null);
    }

    public static TokenizeResponse error(String error, Integer errorPos) {
        return new TokenizeResponse(false, List.of(), error, errorPos);
    }
}
