package org.pragmatica.lambda;

import org.pragmatica.lambda.eval.EvaluationTrace;
import org.pragmatica.lambda.eval.Evaluator;
import org.pragmatica.lambda.eval.EvaluatorConfig;
import org.pragmatica.lambda.eval.Renderer;
import org.pragmatica.lambda.syntax.Lexer;
import org.pragmatica.lambda.syntax.Parser;
import org.pragmatica.lambda.tree.Term;

/**
 * Entry point for parsing and evaluating lambda calculus terms.
 *
 * <p>Example usage:
 * <pre>{@code
 * var lambda = LambdaCalculus.create();
 *
 * var result = lambda.evaluate("(\\x.x) y");
 * lambda.render(result); // "y"
 * }</pre>
 *
 * <p>Failures are reported as {@link org.pragmatica.lambda.error.LambdaError} subclasses:
 * {@code LexError}, {@code ParseError} or {@code NonTermination}.
 */
public final class LambdaCalculus {
    private final Evaluator evaluator;

    private LambdaCalculus(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Create an instance with the default configuration.
     */
    public static LambdaCalculus create() {
        return create(EvaluatorConfig.DEFAULT);
    }

    /**
     * Create an instance with custom configuration.
     */
    public static LambdaCalculus create(EvaluatorConfig config) {
        return new LambdaCalculus(Evaluator.create(config));
    }

    /**
     * Create a builder for custom configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public Evaluator evaluator() {
        return evaluator;
    }

    /**
     * Parse source text into a term.
     *
     * <p>Nesting deeper than {@link Parser#MAX_NESTING_DEPTH} is rejected with a {@code ParseError}.
     * Evaluation and rendering recurse over the term, so very long application chains
     * may still exhaust the call stack.
     */
    public Term parse(String input) {
        return Parser.parse(Lexer.forInput(input).tokenize());
    }

    /**
     * Parse and reduce source text to normal form within the configured step budget.
     */
    public Term evaluate(String input) {
        return evaluator.evaluate(parse(input));
    }

    /**
     * Parse and reduce source text to normal form within {@code maxSteps} reductions.
     */
    public Term evaluate(String input, int maxSteps) {
        return evaluator.evaluate(parse(input), maxSteps);
    }

    /**
     * Parse and reduce source text, recording the rendered form of every step.
     */
    public EvaluationTrace evaluateWithSteps(String input) {
        return evaluator.trace(parse(input));
    }

    /**
     * Parse and reduce source text within {@code maxSteps} reductions, recording the rendered form of every step.
     */
    public EvaluationTrace evaluateWithSteps(String input, int maxSteps) {
        return evaluator.trace(parse(input), maxSteps);
    }

    /**
     * Render a term in canonical form.
     */
    public String render(Term term) {
        return Renderer.render(term);
    }

    public static final class Builder {
        private int maxSteps = EvaluatorConfig.DEFAULT.maxSteps();
        private String freshSuffix = EvaluatorConfig.DEFAULT.freshSuffix();

        private Builder() {}

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder freshSuffix(String freshSuffix) {
            this.freshSuffix = freshSuffix;
            return this;
        }

        public LambdaCalculus build() {
            return create(new EvaluatorConfig(maxSteps, freshSuffix));
        }
    }
}
