package org.pragmatica.lambda.repl;

import org.pragmatica.lambda.LambdaCalculus;
import org.pragmatica.lambda.error.LambdaError;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints evaluation traces for a fixed set of sample terms.
 */
public final class ExampleRunner {
    static final List<String> EXAMPLES = List.of(
        // Identity
        "\\x.x",
        "(\\x.x) y",
        // Self-application
        "(\\x.x x) (\\y.y)",
        // Church booleans
        "\\x.\\y.x",
        "\\x.\\y.y",
        // Church numerals 1 and 2
        "\\f.\\x.f x",
        "\\f.\\x.f (f x)",
        // Y combinator, has no normal form
        "\\f.(\\x.f (x x)) (\\x.f (x x))");

    private final LambdaCalculus lambda;
    private final PrintStream out;
    private final PrintStream err;

    public ExampleRunner(LambdaCalculus lambda, PrintStream out, PrintStream err) {
        this.lambda = lambda;
        this.out = out;
        this.err = err;
    }

    public void run() {
        run(EXAMPLES);
    }

    public void run(List<String> examples) {
        for (var example : examples) {
            out.println();
            out.println("Input: " + example);
            try {
                var trace = lambda.evaluateWithSteps(example);
                out.println("Steps:");
                var steps = trace.steps();
                for (int i = 0; i < steps.size(); i++) {
                    out.println("  " + i + ": " + steps.get(i));
                }
                out.println("Result: " + lambda.render(trace.result()));
            } catch (LambdaError e) {
                err.println("Error: " + e.getMessage());
            }
        }
    }
}
