package com.rdparser.playground.service;

import com.rdparser.playground.config.ParserProperties;
import com.rdparser.playground.dto.AnalysisResponse;
import com.rdparser.playground.exception.InvalidExpressionException;
import com.rdparser.playground.parser.Grammar;
import com.rdparser.playground.parser.ParseResult;
import com.rdparser.playground.parser.ParseTreeNode;
import com.rdparser.playground.parser.Parser;
import com.rdparser.playground.parser.Production;
import com.rdparser.playground.parser.Step;
import com.rdparser.playground.parser.Token;
import com.rdparser.playground.parser.TokenizeResult;
import com.rdparser.playground.parser.Tokenizer;
import com.rdparser.playground.parser.TreeLayout;
import com.rdparser.playground.parser.TreeLayoutResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ExpressionParserService {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionParserService.class);

    static final String EMPTY_EXPRESSION_MESSAGE = "Please enter an expression to parse.";

    private final ParserProperties properties;

    public ExpressionParserService(ParserProperties properties) {
        this.properties = properties;
    }

    /**
     * Runs tokenizer, parser and, unless disabled, tree layout over one expression.
     */
    public AnalysisResponse analyze(String expression) throws InvalidExpressionException {
        return run(expression, properties.includeLayout());
    }

    public AnalysisResponse parse(String expression) throws InvalidExpressionException {
        return run(expression, false);
    }

    public TokenizeResult tokenize(String expression) throws InvalidExpressionException {
        checkLength(expression);

        TokenizeResult result = Tokenizer.tokenize(expression);
        if (result.hasError()) {
            logger.info("Tokenization failed: {}", result.error());
        } else {
            traceTokens(result.tokens());
        }
        return result;
    }

    public TreeLayoutResult layout(ParseTreeNode root) {
        TreeLayoutResult layout = TreeLayout.computeTreeLayout(root);
        logger.debug("Computed layout with {} nodes ({}x{})",
                layout.nodes().size(), layout.width(), layout.height());
        return layout;
    }

    public List<Production> grammar() {
        return Grammar.productions();
    }

    private AnalysisResponse run(String expression, boolean withLayout) throws InvalidExpressionException {
        long startTime = System.currentTimeMillis();

        if (expression == null || expression.trim().isEmpty()) {
            throw new InvalidExpressionException(EMPTY_EXPRESSION_MESSAGE);
        }
        checkLength(expression);

        logger.info("Starting analysis of {} characters", expression.length());

        TokenizeResult lexed = Tokenizer.tokenize(expression);
        if (lexed.hasError()) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.info("Lexical error after {}ms: {}", analysisTime, lexed.error());
            return AnalysisResponse.lexicalError(lexed.error(), lexed.errorPos(), analysisTime);
        }
        traceTokens(lexed.tokens());

        ParseResult parsed = Parser.parse(lexed.tokens());
        traceSteps(parsed.steps());
        if (parsed.hasError()) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.info("Syntax error after {}ms and {} steps: {}",
                    analysisTime, parsed.steps().size(), parsed.error());
            return AnalysisResponse.syntaxError(lexed.tokens(), parsed.steps(), parsed.error(),
                    parsed.errorPos(), parsed.errorKind(), analysisTime);
        }

        TreeLayoutResult layout = withLayout ? layout(parsed.tree()) : null;

        long analysisTime = System.currentTimeMillis() - startTime;
        logger.info("Analysis completed in {}ms: {} tokens, {} steps, {} tree nodes",
                analysisTime, lexed.tokens().size(), parsed.steps().size(), parsed.nodes().size());

        return AnalysisResponse.success(lexed.tokens(), parsed.tree(), parsed.steps(), layout, analysisTime);
    }

    private void checkLength(String expression) throws InvalidExpressionException {
        if (expression != null && expression.length() > properties.maxExpressionLength()) {
            throw new InvalidExpressionException(
                "Expression exceeds maximum length of " + properties.maxExpressionLength() + " characters");
        }
    }

    private void traceTokens(List<Token> tokens) {
        if (!properties.traceTokens()) {
            return;
        }
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            logger.debug("Token {}: '{}' -> {} at [{}-{}]",
                    i, token.value(), token.type(), token.start(), token.end());
        }
    }

    private void traceSteps(List<Step> steps) {
        if (!properties.traceSteps()) {
            return;
        }
        for (Step step : steps) {
            logger.debug("Step {} (depth {}): {} | {} | lookahead '{}'",
                    step.sequenceIndex(), step.depth(), step.rule(), step.action(), step.token());
        }
    }
}
