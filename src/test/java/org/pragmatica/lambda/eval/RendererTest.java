package org.pragmatica.lambda.eval;

import org.junit.jupiter.api.Test;
import org.pragmatica.lambda.syntax.Lexer;
import org.pragmatica.lambda.syntax.Parser;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.lambda.tree.Term.abstraction;
import static org.pragmatica.lambda.tree.Term.variable;

class RendererTest {

    private static String renderParsed(String input) {
        return Renderer.render(Parser.parse(Lexer.forInput(input).tokenize()));
    }

    @Test
    void render_variable_isName() {
        assertEquals("x", renderParsed("x"));
    }

    @Test
    void render_abstraction_parenthesizedWithLambda() {
        assertEquals("(λx.x)", renderParsed("\\x.x"));
    }

    @Test
    void render_nestedAbstraction_eachParenthesized() {
        assertEquals("(λx.(λy.x))", renderParsed("λx.λy.x"));
    }

    @Test
    void render_leftNestedApplication_noParentheses() {
        assertEquals("x y z", renderParsed("x y z"));
    }

    @Test
    void render_rightNestedApplication_parenthesized() {
        assertEquals("x (y z)", renderParsed("x (y z)"));
    }

    @Test
    void render_abstractionInFunctionPosition_keepsOwnParentheses() {
        assertEquals("(λx.x) y", renderParsed("(\\x.x) y"));
    }

    @Test
    void render_abstractionAsArgument_wrappedAgain() {
        assertEquals("f ((λx.x))", renderParsed("f (\\x.x)"));
    }

    @Test
    void render_freshName_includesSuffix() {
        assertEquals("(λy'.y)", Renderer.render(abstraction("y'", variable("y"))));
    }

    @Test
    void render_renderedAbstraction_parsesBack() {
        var input = "\\f.\\x.f (f x)";
        var rendered = renderParsed(input);

        assertEquals(rendered, renderParsed(rendered));
    }
}
