package org.pragmatica.lambda.eval;

import org.pragmatica.lambda.tree.Term;

import java.util.List;

/**
 * Normal form together with the rendered form of every intermediate term,
 * starting with the input itself.
 */
public record EvaluationTrace(Term result, List<String> steps) {
    public EvaluationTrace {
        steps = List.copyOf(steps);
    }

    /**
     * Number of reductions performed.
     */
    public int reductions() {
        return steps.size() - 1;
    }
}
