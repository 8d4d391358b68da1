package com.rdparser.playground.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ExpressionRequest(
        @NotNull(message = "Expression cannot be null")
        @Size(max = 10_000, message = "Expression cannot exceed 10,000 characters")
        String expression) {
}
