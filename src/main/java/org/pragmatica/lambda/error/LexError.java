package org.pragmatica.lambda.error;

import org.pragmatica.lambda.tree.SourceLocation;

/**
 * Input character that does not start any token.
 */
public final class LexError extends LambdaError {
    private final char character;
    private final SourceLocation location;

    public LexError(char character, SourceLocation location) {
        super("Unexpected character '" + character + "' at " + location);
        this.character = character;
        this.location = location;
    }

    public char character() {
        return character;
    }

    public SourceLocation location() {
        return location;
    }
}
