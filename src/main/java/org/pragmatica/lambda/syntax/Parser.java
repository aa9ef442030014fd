package org.pragmatica.lambda.syntax;

import org.pragmatica.lambda.error.ParseError;
import org.pragmatica.lambda.tree.Term;

import java.util.List;

/**
 * Recursive descent parser for lambda terms.
 *
 * <pre>
 * expression  := application
 * application := atom atom*
 * atom        := LAMBDA VAR DOT expression
 *              | VAR
 *              | LPAREN expression RPAREN
 * </pre>
 *
 * Application is left-associative, and a lambda body extends as far right as possible.
 *
 * <p>Abstractions and parenthesized groups may nest at most {@value #MAX_NESTING_DEPTH} levels deep.
 */
public final class Parser {
    public static final int MAX_NESTING_DEPTH = 1000;

    private final List<Token> tokens;
    private int pos;
    private int depth;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse a complete token sequence (terminated by {@link Token.Eof}) into a single term.
     *
     * @throws ParseError at the first token that does not fit the grammar
     */
    public static Term parse(List<Token> tokens) {
        if (tokens.isEmpty() || !(tokens.get(tokens.size() - 1) instanceof Token.Eof)) {
            throw new IllegalArgumentException("Token sequence must end with end of input");
        }
        return new Parser(tokens).parseInput();
    }

    private Term parseInput() {
        var term = parseExpression();
        if (!isAtEnd()) {
            throw new ParseError(peek(), "end of input");
        }
        return term;
    }

    private Term parseExpression() {
        return parseApplication();
    }

    private Term parseApplication() {
        var term = parseAtom();
        while (startsAtom(peek())) {
            term = Term.application(term, parseAtom());
        }
        return term;
    }

    private Term parseAtom() {
        var token = peek();

        if (token instanceof Token.Lambda) {
            enterNested(token);
            var parameter = expect(Token.Variable.class, "parameter name after lambda");
            expect(Token.Dot.class, "'.' after parameter name");
            var body = parseExpression();
            depth--;
            return Term.abstraction(parameter.name(), body);
        }

        if (token instanceof Token.Variable variable) {
            advance();
            return Term.variable(variable.name());
        }

        if (token instanceof Token.LParen) {
            enterNested(token);
            var inner = parseExpression();
            expect(Token.RParen.class, "')' after expression");
            depth--;
            return inner;
        }

        throw new ParseError(token, "expression");
    }

    private void enterNested(Token token) {
        if (++depth > MAX_NESTING_DEPTH) {
            throw new ParseError(token, "nesting depth of at most " + MAX_NESTING_DEPTH);
        }
        advance();
    }

    private static boolean startsAtom(Token token) {
        return token instanceof Token.Lambda
            || token instanceof Token.Variable
            || token instanceof Token.LParen;
    }

    private boolean isAtEnd() {
        return peek() instanceof Token.Eof;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    private <T extends Token> T expect(Class<T> tokenClass, String expected) {
        var token = peek();
        if (!tokenClass.isInstance(token)) {
            throw new ParseError(token, expected);
        }
        advance();
        return tokenClass.cast(token);
    }
}
