package org.pragmatica.lambda.error;

import org.pragmatica.lambda.syntax.Token;
import org.pragmatica.lambda.tree.SourceLocation;

/**
 * Token sequence that does not match the grammar.
 */
public final class ParseError extends LambdaError {
    private final Token found;
    private final String expected;

    public ParseError(Token found, String expected) {
        super("Unexpected " + found.description() + " at " + found.location() + ", expected " + expected);
        this.found = found;
        this.expected = expected;
    }

    public Token found() {
        return found;
    }

    public String expected() {
        return expected;
    }

    public SourceLocation location() {
        return found.location();
    }
}
