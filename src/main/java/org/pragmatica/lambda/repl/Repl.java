package org.pragmatica.lambda.repl;

import org.pragmatica.lambda.LambdaCalculus;
import org.pragmatica.lambda.error.LambdaError;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * Interactive read-evaluate-print loop over a {@link LambdaCalculus} instance.
 */
public final class Repl {
    private static final String PROMPT = "λ> ";

    private final LambdaCalculus lambda;
    private final Definitions definitions;
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    public Repl(LambdaCalculus lambda, Definitions definitions, BufferedReader in, PrintStream out, PrintStream err) {
        this.lambda = lambda;
        this.definitions = definitions;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    /**
     * Process lines until {@code :quit} or end of input.
     */
    public void run() {
        out.println("Lambda Calculus Interpreter");
        out.println("Type :help for instructions or :quit to exit");

        while (true) {
            out.print(PROMPT);
            out.flush();
            var line = readLine();
            if (line == null || !handle(line.trim())) {
                break;
            }
        }
        out.println();
        out.println("Goodbye!");
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Handle a single trimmed input line.
     *
     * @return {@code false} when the session should end
     */
    boolean handle(String line) {
        if (line.isEmpty()) {
            return true;
        }
        if (line.equals(":quit")) {
            return false;
        }
        try {
            dispatch(line);
        } catch (LambdaError e) {
            err.println("Error: " + e.getMessage());
        }
        return true;
    }

    private void dispatch(String line) {
        if (line.equals(":help")) {
            printHelp();
        } else if (line.equals(":defs")) {
            printDefinitions();
        } else if (line.equals(":clear")) {
            definitions.reset();
            out.println("All user definitions cleared.");
        } else if (line.startsWith(":def ")) {
            define(line.substring(5).trim());
        } else if (line.startsWith(":steps ")) {
            printSteps(line.substring(7).trim());
        } else {
            var result = lambda.evaluate(definitions.expand(line));
            out.println(lambda.render(result));
        }
    }

    private void define(String arguments) {
        var parts = arguments.split("\\s+", 2);
        if (parts.length < 2) {
            err.println("Usage: :def <name> <expression>");
            return;
        }
        var name = parts[0];
        var text = parts[1];
        try {
            definitions.define(name, text);
            out.println("Defined " + name + " = " + text);
        } catch (LambdaError | IllegalArgumentException e) {
            err.println("Error in definition: " + e.getMessage());
        }
    }

    private void printSteps(String text) {
        var trace = lambda.evaluateWithSteps(definitions.expand(text));
        out.println();
        out.println("Evaluation steps:");
        var steps = trace.steps();
        for (int i = 0; i < steps.size(); i++) {
            out.println("  " + i + ": " + steps.get(i));
        }
        out.println();
    }

    private void printDefinitions() {
        out.println();
        out.println("Defined terms:");
        definitions.entries()
                   .forEach((name, text) -> out.println("  " + name + " = " + text));
        out.println();
    }

    private void printHelp() {
        out.println("""

            Lambda Calculus Interpreter Help:
              :help                 - Show this help message
              :quit                 - Exit the REPL
              :def <name> <expr>    - Define a named expression
              :defs                 - List all definitions
              :steps <expr>         - Show evaluation steps
              :clear                - Clear all definitions
              <expression>          - Evaluate a lambda expression

            Lambda Expression Syntax:
              \\x.e                  - Lambda abstraction (can also use λ)
              (e1 e2)               - Application (parentheses optional in some cases)
              x, y, z, ...          - Variables

            Examples:
              \\x.x                  - Identity function
              (\\x.x) y              - Apply identity to y
              (\\x.\\y.x) a b         - Apply function to multiple arguments
            """);
    }
}
