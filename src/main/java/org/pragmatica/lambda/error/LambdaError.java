package org.pragmatica.lambda.error;

/**
 * Base of all failures reported by lexing, parsing and evaluation.
 * Each failure is fatal to the call that raised it.
 */
public abstract sealed class LambdaError extends RuntimeException permits LexError, ParseError, NonTermination {

    protected LambdaError(String message) {
        super(message);
    }
}
