package org.pragmatica.lambda.repl;

import org.pragmatica.lambda.LambdaCalculus;

import java.io.BufferedReader;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

public final class Main {
    private Main() {}

    public static void main(String[] args) {
        var out = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        var err = new PrintStream(new FileOutputStream(FileDescriptor.err), true, StandardCharsets.UTF_8);
        var lambda = LambdaCalculus.create();

        if (args.length == 0) {
            var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new Repl(lambda, Definitions.withPredefined(lambda), in, out, err).run();
        } else if (args.length == 1 && args[0].equals("--examples")) {
            new ExampleRunner(lambda, out, err).run();
        } else {
            err.println("Usage: lambda [--examples]");
            System.exit(2);
        }
    }
}
