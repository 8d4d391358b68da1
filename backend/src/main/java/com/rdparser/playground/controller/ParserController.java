package com.rdparser.playground.controller;

import com.rdparser.playground.dto.AnalysisResponse;
import com.rdparser.playground.dto.ExpressionRequest;
import com.rdparser.playground.dto.TokenView;
import com.rdparser.playground.dto.TokenizeResponse;
import com.rdparser.playground.exception.InvalidExpressionException;
import com.rdparser.playground.parser.ParseTreeNode;
import com.rdparser.playground.parser.Production;
import com.rdparser.playground.parser.TokenizeResult;
import com.rdparser.playground.parser.TreeLayoutResult;
import com.rdparser.playground.service.ExpressionParserService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

import java.util.List;

@RestController
@RequestMapping("/api/parser")
@CrossOrigin(origins = "*")
@Validated
public class ParserController {

    private static final Logger logger = LoggerFactory.getLogger(ParserController.class);

    private final ExpressionParserService parserService;

    public ParserController(ExpressionParserService parserService) {
        this.parserService = parserService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody ExpressionRequest request)
            throws InvalidExpressionException {
        logger.debug("Received analysis request ({} chars)", request.expression().length());

        AnalysisResponse response = parserService.analyze(request.expression());

        logger.debug("Analysis finished: success={}, stage={}", response.success(), response.stage());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/parse")
    public ResponseEntity<AnalysisResponse> parse(@Valid @RequestBody ExpressionRequest request)
            throws InvalidExpressionException {
        logger.debug("Received parse request ({} chars)", request.expression().length());

        return ResponseEntity.ok(parserService.parse(request.expression()));
    }

    @PostMapping("/tokenize")
    public ResponseEntity<TokenizeResponse> tokenize(@Valid @RequestBody ExpressionRequest request)
            throws InvalidExpressionException {
        TokenizeResult result = parserService.tokenize(request.expression());

        if (result.hasError()) {
            return ResponseEntity.ok(TokenizeResponse.error(result.error(), result.errorPos()));
        }
        return ResponseEntity.ok(TokenizeResponse.success(
                result.tokens().stream().map(TokenView::of).toList()));
    }

    @PostMapping("/layout")
    public ResponseEntity<TreeLayoutResult> layout(@RequestBody ParseTreeNode root) {
        return ResponseEntity.ok(parserService.layout(root));
    }

    @GetMapping("/grammar")
    public ResponseEntity<List<Production>> grammar() {
        return ResponseEntity.ok(parserService.grammar());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Parser playground is running");
    }

    @ExceptionHandler(InvalidExpressionException.class)
    public ResponseEntity<AnalysisResponse> handleInvalidExpression(InvalidExpressionException e) {
        logger.warn("Rejected expression: {}", e.getMessage());
        return ResponseEntity.badRequest().body(AnalysisResponse.invalid(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<AnalysisResponse> handleValidationException(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);
        return ResponseEntity.badRequest().body(AnalysisResponse.invalid(errorMessage.toString()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<AnalysisResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(AnalysisResponse.invalid("Malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<AnalysisResponse> handleUnexpected(Exception e) {
        logger.error("Unexpected error while handling parser request", e);
        return ResponseEntity.internalServerError()
                .body(AnalysisResponse.invalid("Internal server error: " + e.getMessage()));
    }
}
