package com.rdparser.playground.parser;

public record Point(double x, double y) {
}
