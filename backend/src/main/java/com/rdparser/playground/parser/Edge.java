package com.rdparser.playground.parser;

public record Edge(
        int fromId,
        int toId,
        Point from,
        Point to) {
}
