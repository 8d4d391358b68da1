package com.rdparser.playground.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "parser")
@Validated
public record ParserProperties(
    @Positive
    @DefaultValue("1000")
    int maxExpressionLength,

    @DefaultValue("false")
    boolean traceTokens,

    @DefaultValue("false")
    boolean traceSteps,

    @DefaultValue("true")
    boolean includeLayout
) {
}
