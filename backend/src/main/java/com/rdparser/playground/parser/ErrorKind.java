package com.rdparser.playground.parser;

public enum ErrorKind {
    LEXICAL,
    UNEXPECTED_TOKEN,
    TRAILING_INPUT
}
