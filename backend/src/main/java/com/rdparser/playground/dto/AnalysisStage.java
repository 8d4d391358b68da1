package com.rdparser.playground.dto;

public enum AnalysisStage {
    VALIDATION,
    LEXICAL,
    SYNTAX,
    COMPLETE
}
