package org.pragmatica.lambda.syntax;

import org.pragmatica.lambda.tree.SourceLocation;

/**
 * Token types produced by the lexer.
 */
public sealed interface Token {
    /**
     * Location of the first character of the token.
     */
    SourceLocation location();

    /**
     * Canonical source text of the token.
     */
    String text();

    /**
     * Human-readable description for diagnostics.
     */
    String description();

    // \ or λ
    record Lambda(SourceLocation location) implements Token {
        @Override
        public String text() {
            return "λ";
        }

        @Override
        public String description() {
            return "'λ'";
        }
    }

    record Variable(SourceLocation location, String name) implements Token {
        @Override
        public String text() {
            return name;
        }

        @Override
        public String description() {
            return "variable '" + name + "'";
        }
    }

    record Dot(SourceLocation location) implements Token {
        @Override
        public String text() {
            return ".";
        }

        @Override
        public String description() {
            return "'.'";
        }
    }

    record LParen(SourceLocation location) implements Token {
        @Override
        public String text() {
            return "(";
        }

        @Override
        public String description() {
            return "'('";
        }
    }

    record RParen(SourceLocation location) implements Token {
        @Override
        public String text() {
            return ")";
        }

        @Override
        public String description() {
            return "')'";
        }
    }

    record Eof(SourceLocation location) implements Token {
        @Override
        public String text() {
            return "";
        }

        @Override
        public String description() {
            return "end of input";
        }
    }
}
