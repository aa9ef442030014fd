package org.pragmatica.lambda.error;

/**
 * Reduction reached the step budget without finding a normal form.
 */
public final class NonTermination extends LambdaError {
    private final int maxSteps;

    public NonTermination(int maxSteps) {
        super("Evaluation exceeded maximum steps (" + maxSteps + "), possible non-terminating expression");
        this.maxSteps = maxSteps;
    }

    public int maxSteps() {
        return maxSteps;
    }
}
