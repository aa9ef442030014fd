package org.pragmatica.lambda.syntax;

import org.pragmatica.lambda.error.LexError;
import org.pragmatica.lambda.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lexer for lambda calculus source text.
 *
 * <p>The input is trimmed before scanning; all locations are relative to the trimmed text.
 */
public final class Lexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 16;
    private static final char GREEK_LAMBDA = 'λ';

    private final String input;
    private SourceLocation location;

    private Lexer(String input) {
        this.input = input;
        this.location = SourceLocation.START;
    }

    public static Lexer forInput(String input) {
        Objects.requireNonNull(input, "input");
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new Lexer(input.trim());
    }

    /**
     * Scan all remaining tokens. The last element is always {@link Token.Eof}.
     */
    public List<Token> tokenize() {
        var tokens = new ArrayList<Token>();
        while (true) {
            var token = nextToken();
            tokens.add(token);
            if (token instanceof Token.Eof) {
                return List.copyOf(tokens);
            }
        }
    }

    /**
     * Scan the next token, or {@link Token.Eof} once the input is exhausted.
     *
     * @throws LexError if the next character cannot start a token
     */
    public Token nextToken() {
        skipWhitespace();
        var start = location;
        if (isAtEnd()) {
            return new Token.Eof(start);
        }
        char c = peek();
        if (isLetter(c)) {
            return scanVariable(start);
        }
        advance();
        return switch (c) {
            case '\\', GREEK_LAMBDA -> new Token.Lambda(start);
            case '.' -> new Token.Dot(start);
            case '(' -> new Token.LParen(start);
            case ')' -> new Token.RParen(start);
            default -> throw new LexError(c, start);
        };
    }

    private Token scanVariable(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return new Token.Variable(start, sb.toString());
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return location.offset() >= input.length();
    }

    private char peek() {
        return input.charAt(location.offset());
    }

    private char advance() {
        char c = peek();
        location = location.advance(c);
        return c;
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isLetter(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
