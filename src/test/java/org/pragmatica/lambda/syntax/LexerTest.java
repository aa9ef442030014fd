package org.pragmatica.lambda.syntax;

import org.junit.jupiter.api.Test;
import org.pragmatica.lambda.error.LexError;
import org.pragmatica.lambda.tree.SourceLocation;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    @Test
    void tokenize_abstraction_producesAllTokens() {
        var tokens = Lexer.forInput("\\x.x").tokenize();

        assertEquals(5, tokens.size());
        assertInstanceOf(Token.Lambda.class, tokens.get(0));
        assertInstanceOf(Token.Variable.class, tokens.get(1));
        assertInstanceOf(Token.Dot.class, tokens.get(2));
        assertInstanceOf(Token.Variable.class, tokens.get(3));
        assertInstanceOf(Token.Eof.class, tokens.get(4));
        assertEquals(4, tokens.get(4).location().offset());
    }

    @Test
    void tokenize_greekLambda_sameAsBackslash() {
        var ascii = Lexer.forInput("\\f.\\x.f x").tokenize();
        var greek = Lexer.forInput("λf.λx.f x").tokenize();

        assertEquals(ascii, greek);
    }

    @Test
    void tokenize_parentheses_recognized() {
        var tokens = Lexer.forInput("(x)").tokenize();

        assertInstanceOf(Token.LParen.class, tokens.get(0));
        assertInstanceOf(Token.RParen.class, tokens.get(2));
    }

    @Test
    void tokenize_identifierWithDigits_singleVariable() {
        var tokens = Lexer.forInput("abc12 x9y").tokenize();

        assertEquals(3, tokens.size());
        assertEquals("abc12", ((Token.Variable) tokens.get(0)).name());
        assertEquals("x9y", ((Token.Variable) tokens.get(1)).name());
    }

    @Test
    void tokenize_adjacentIdentifiers_splitAtNonIdentifierCharacter() {
        var tokens = Lexer.forInput("f(x)").tokenize();

        assertThat(tokens).extracting(Token::text)
                          .containsExactly("f", "(", "x", ")", "");
    }

    @Test
    void tokenize_whitespace_skippedAndLocationsTracked() {
        var tokens = Lexer.forInput("  x \t y\n z  ").tokenize();

        assertEquals(4, tokens.size());
        assertEquals(SourceLocation.at(1, 1, 0), tokens.get(0).location());
        assertEquals(SourceLocation.at(1, 5, 4), tokens.get(1).location());
        assertEquals(SourceLocation.at(2, 2, 7), tokens.get(2).location());
    }

    @Test
    void tokenize_emptyInput_onlyEof() {
        var tokens = Lexer.forInput("   ").tokenize();

        assertEquals(1, tokens.size());
        assertEquals(new Token.Eof(SourceLocation.START), tokens.get(0));
    }

    @Test
    void tokenize_unknownCharacter_failsWithLocation() {
        var error = assertThrows(LexError.class, () -> Lexer.forInput("x + y").tokenize());

        assertEquals('+', error.character());
        assertEquals(2, error.location().offset());
        assertEquals("Unexpected character '+' at 1:3", error.getMessage());
    }

    @Test
    void tokenize_identifierStartingWithDigit_fails() {
        var error = assertThrows(LexError.class, () -> Lexer.forInput("1x").tokenize());

        assertEquals('1', error.character());
        assertEquals(0, error.location().offset());
    }

    @Test
    void nextToken_afterEnd_keepsReturningEof() {
        var lexer = Lexer.forInput("x");

        assertInstanceOf(Token.Variable.class, lexer.nextToken());
        assertInstanceOf(Token.Eof.class, lexer.nextToken());
        assertInstanceOf(Token.Eof.class, lexer.nextToken());
    }

    @Test
    void tokenize_concatenatedText_reproducesInputStructure() {
        var input = "(\\f.\\x.f (f x)) y";
        var tokens = Lexer.forInput(input).tokenize();

        var joined = tokens.stream()
                           .map(Token::text)
                           .collect(Collectors.joining());

        assertEquals(input.replace('\\', 'λ').replaceAll("\\s", ""), joined);
    }

    @Test
    void tokenize_result_isImmutable() {
        List<Token> tokens = Lexer.forInput("x").tokenize();

        assertThrows(UnsupportedOperationException.class, () -> tokens.add(new Token.Dot(SourceLocation.START)));
    }

    @Test
    void forInput_oversizedInput_rejected() {
        var input = "x".repeat(1_000_001);

        assertThrows(IllegalArgumentException.class, () -> Lexer.forInput(input));
    }
}
