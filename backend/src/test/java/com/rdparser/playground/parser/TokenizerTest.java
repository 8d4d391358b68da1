package com.rdparser.playground.parser;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

class TokenizerTest {

    private static Token token(TokenType type, String value, int start, int end) {
        return new Token(type, value, start, end);
    }

    @Test void groupedExpression() {
        TokenizeResult result = Tokenizer.tokenize("(3+5)*2");

        assertNull(result.error());
        assertNull(result.errorPos());
        assertEquals(List.of(
                token(TokenType.LPAREN, "(", 0, 1),
                token(TokenType.NUMBER, "3", 1, 2),
                token(TokenType.PLUS, "+", 2, 3),
                token(TokenType.NUMBER, "5", 3, 4),
                token(TokenType.RPAREN, ")", 4, 5),
                token(TokenType.STAR, "*", 5, 6),
                token(TokenType.NUMBER, "2", 6, 7),
                token(TokenType.EOF, "EOF", 7, 7)), result.tokens());
    }

    @Test void emptyInputYieldsOnlyEof() {
        TokenizeResult result = Tokenizer.tokenize("");

        assertFalse(result.hasError());
        assertEquals(List.of(token(TokenType.EOF, "EOF", 0, 0)), result.tokens());
    }

    @Test void nullInputIsTreatedAsEmpty() {
        assertEquals(List.of(token(TokenType.EOF, "EOF", 0, 0)), Tokenizer.tokenize(null).tokens());
    }

    @Test void whitespaceIsSkippedAndEofSitsAtInputLength() {
        TokenizeResult result = Tokenizer.tokenize("  a -\tb  ");

        assertEquals(List.of(
                token(TokenType.ID, "a", 2, 3),
                token(TokenType.MINUS, "-", 4, 5),
                token(TokenType.ID, "b", 6, 7),
                token(TokenType.EOF, "EOF", 9, 9)), result.tokens());
    }

    @Test void pastedSpaceCharactersAreSkipped() {
        TokenizeResult result = Tokenizer.tokenize("1\u00A0+\u202F2\uFEFF");

        assertFalse(result.hasError());
        assertEquals(List.of(
                token(TokenType.NUMBER, "1", 0, 1),
                token(TokenType.PLUS, "+", 2, 3),
                token(TokenType.NUMBER, "2", 4, 5),
                token(TokenType.EOF, "EOF", 6, 6)), result.tokens());
    }

    @Test void carriageReturnIsPlainWhitespace() {
        TokenizeResult result = Tokenizer.tokenize("a\r\n$");

        assertEquals("Unexpected character '$' at position 3", result.error());
        assertEquals(3, result.errorPos());
    }

    @Test void nulCharacterIsRejectedInPlace() {
        TokenizeResult result = Tokenizer.tokenize("1\u00002");

        assertEquals(1, result.errorPos());
    }

    @Test void decimalNumber() {
        assertEquals(token(TokenType.NUMBER, "3.14", 0, 4), Tokenizer.tokenize("3.14").tokens().get(0));
    }

    @Test void trailingPointStaysInNumber() {
        assertEquals(token(TokenType.NUMBER, "5.", 0, 2), Tokenizer.tokenize("5./2").tokens().get(0));
    }

    @Test void secondDecimalPointIsRejected() {
        TokenizeResult result = Tokenizer.tokenize("1.2.3");

        assertEquals("Unexpected character '.' at position 3", result.error());
        assertEquals(3, result.errorPos());
        assertTrue(result.tokens().isEmpty());
    }

    @Test void unexpectedCharacter() {
        TokenizeResult result = Tokenizer.tokenize("1$2");

        assertEquals("Unexpected character '$' at position 1", result.error());
        assertEquals(1, result.errorPos());
        assertTrue(result.tokens().isEmpty());
    }

    @Test void identifiersMixLettersDigitsAndUnderscores() {
        List<Token> tokens = Tokenizer.tokenize("_tmp1 * myVar2").tokens();

        assertEquals(token(TokenType.ID, "_tmp1", 0, 5), tokens.get(0));
        assertEquals(token(TokenType.STAR, "*", 6, 7), tokens.get(1));
        assertEquals(token(TokenType.ID, "myVar2", 8, 14), tokens.get(2));
    }

    @Test void digitsFollowedByLettersSplit() {
        List<Token> tokens = Tokenizer.tokenize("2x").tokens();

        assertEquals(token(TokenType.NUMBER, "2", 0, 1), tokens.get(0));
        assertEquals(token(TokenType.ID, "x", 1, 2), tokens.get(1));
    }

    @Test void everyOperatorIsRecognised() {
        List<TokenType> types = Tokenizer.tokenize("+-*/()").tokens().stream().map(Token::type).toList();

        assertEquals(List.of(TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH,
                TokenType.LPAREN, TokenType.RPAREN, TokenType.EOF), types);
    }

    @Test void tokensAreOrderedAndEndWithSingleEof() {
        List<Token> tokens = Tokenizer.tokenize("alpha + 12.5 * (beta - 3) / gamma").tokens();

        for (int i = 1; i < tokens.size(); i++) {
            assertTrue(tokens.get(i - 1).start() <= tokens.get(i).start());
        }
        assertEquals(1, tokens.stream().filter(t -> t.is(TokenType.EOF)).count());
        assertTrue(tokens.get(tokens.size() - 1).is(TokenType.EOF));
    }

    @Test void typeLabels() {
        assertEquals("Identifier", TokenType.ID.label());
        assertEquals("End of Input", TokenType.EOF.label());
    }
}
