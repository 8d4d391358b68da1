package com.rdparser.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rdparser.playground.parser.ErrorKind;
import com.rdparser.playground.parser.ParseTreeNode;
import com.rdparser.playground.parser.Step;
import com.rdparser.playground.parser.Token;
import com.rdparser.playground.parser.TreeLayoutResult;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResponse(
        boolean success,
        AnalysisStage stage,
        List<Token> tokens,
        ParseTreeNode tree,
        List<Step> steps,
        TreeLayoutResult layout,
        String error,
        Integer errorPos,
        ErrorKind errorKind,
        long analysisTimeMs) {

    public static AnalysisResponse success(List<Token> tokens, ParseTreeNode tree, List<Step> steps,
            TreeLayoutResult layout, long analysisTimeMs) {
        return new AnalysisResponse(
                true,
                AnalysisStage.COMPLETE,
                tokens,
                tree,
                steps,
                layout,
                null,
                null,
                null,
                analysisTimeMs);
    }

    public static AnalysisResponse lexicalError(String error, Integer errorPos, long analysisTimeMs) {
        return new AnalysisResponse(
                false,
                AnalysisStage.LEXICAL,
                List.of(),
                null,
                List.of(),
                null,
                error,
                errorPos,
                ErrorKind.LEXICAL,
                analysisTimeMs);
    }

    public static AnalysisResponse syntaxError(List<Token> tokens, List<Step> steps, String error,
            Integer errorPos, ErrorKind errorKind, long analysisTimeMs) {
        return new AnalysisResponse(
                false,
                AnalysisStage.SYNTAX,
                tokens,
                null,
                steps,
                null,
                error,
                errorPos,
                errorKind,
                analysisTimeMs);
    }

    public static AnalysisResponse invalid(String error) {
        return new AnalysisResponse(
                false,
                AnalysisStage.VALIDATION,
                null,
                null,
                null,
                null,
                error,
                null,
                null,
                0);
    }
}
