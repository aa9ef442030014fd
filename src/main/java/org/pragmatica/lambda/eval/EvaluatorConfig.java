package org.pragmatica.lambda.eval;

import java.util.Objects;

/**
 * Evaluator configuration options.
 *
 * @param maxSteps    reduction budget used when a call does not pass its own
 * @param freshSuffix marker appended to a parameter name during alpha conversion
 */
public record EvaluatorConfig(
    int maxSteps,
    String freshSuffix
) {
    public static final EvaluatorConfig DEFAULT = new EvaluatorConfig(
        1000,
        "'"
    );

    public EvaluatorConfig {
        requirePositive(maxSteps);
        Objects.requireNonNull(freshSuffix, "freshSuffix");
        // Fresh names must not be writable in source, otherwise they could collide with user names
        if (freshSuffix.isEmpty() || Character.isLetterOrDigit(freshSuffix.charAt(0))) {
            throw new IllegalArgumentException("Fresh name suffix must be non-empty and start with a non-identifier character");
        }
    }

    public EvaluatorConfig withMaxSteps(int maxSteps) {
        return new EvaluatorConfig(maxSteps, freshSuffix);
    }

    static int requirePositive(int maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("Step budget must be positive, got " + maxSteps);
        }
        return maxSteps;
    }
}
