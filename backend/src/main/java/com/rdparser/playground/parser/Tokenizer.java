package com.rdparser.playground.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexical analyzer for arithmetic expressions.
 *
 * <p>Produces numbers (integers and decimals), identifiers, the four arithmetic
 * operators and parentheses. The stream always ends with a single EOF token
 * located at the input length.
 */
public final class Tokenizer {

    private Tokenizer() {
    }

    public static TokenizeResult tokenize(String input) {
        String source = input != null ? input : "";
        List<Token> tokens = new ArrayList<>();
        int pos = 0;

        while (pos < source.length()) {
            char ch = source.charAt(pos);

            if (isWhitespace(ch)) {
                pos++;
                continue;
            }

            TokenType symbol = TokenType.forSymbol(ch);
            if (symbol != null) {
                tokens.add(new Token(symbol, String.valueOf(ch), pos, pos + 1));
                pos++;
                continue;
            }

            if (isDigit(ch)) {
                int start = pos;
                boolean hasDecimal = false;

                while (pos < source.length() && (isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
                    if (source.charAt(pos) == '.') {
                        // a second point ends the number and is rescanned on its own
                        if (hasDecimal) {
                            break;
                        }
                        hasDecimal = true;
                    }
                    pos++;
                }

                tokens.add(new Token(TokenType.NUMBER, source.substring(start, pos), start, pos));
                continue;
            }

            if (isIdentifierStart(ch)) {
                int start = pos;
                while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                    pos++;
                }

                tokens.add(new Token(TokenType.ID, source.substring(start, pos), start, pos));
                continue;
            }

            return TokenizeResult.error("Unexpected character '" + ch + "' at position " + pos, pos);
        }

        tokens.add(Token.eof(pos));
        return TokenizeResult.success(tokens);
    }

    private static boolean isWhitespace(char ch) {
        return Character.isWhitespace(ch) || Character.isSpaceChar(ch) || ch == '\uFEFF';
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isIdentifierStart(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
    }

    private static boolean isIdentifierPart(char ch) {
        return isIdentifierStart(ch) || isDigit(ch);
    }
}
