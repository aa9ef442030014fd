package org.pragmatica.lambda.tree;

import java.util.Objects;
import java.util.function.Function;

/**
 * Lambda term - immutable tree of variables, abstractions and applications.
 *
 * <p>Terms have no identity beyond structural equality. Reduction never mutates
 * a term; it builds new nodes and shares the subtrees it did not touch.
 *
 * <p>Traversals dispatch through {@link #fold(Function, Function, Function)}, so
 * adding a new kind of term breaks every traversal at compile time until it is handled.
 */
public sealed interface Term {

    /**
     * Apply the function matching the kind of this term.
     */
    <R> R fold(Function<Variable, R> onVariable,
               Function<Abstraction, R> onAbstraction,
               Function<Application, R> onApplication);

    static Variable variable(String name) {
        return new Variable(name);
    }

    static Abstraction abstraction(String parameter, Term body) {
        return new Abstraction(parameter, body);
    }

    static Application application(Term left, Term right) {
        return new Application(left, right);
    }

    /**
     * Variable reference: x
     */
    record Variable(String name) implements Term {
        public Variable {
            requireName(name);
        }

        @Override
        public <R> R fold(Function<Variable, R> onVariable,
                          Function<Abstraction, R> onAbstraction,
                          Function<Application, R> onApplication) {
            return onVariable.apply(this);
        }
    }

    /**
     * Abstraction: λparameter.body
     */
    record Abstraction(String parameter, Term body) implements Term {
        public Abstraction {
            requireName(parameter);
            Objects.requireNonNull(body, "body");
        }

        @Override
        public <R> R fold(Function<Variable, R> onVariable,
                          Function<Abstraction, R> onAbstraction,
                          Function<Application, R> onApplication) {
            return onAbstraction.apply(this);
        }
    }

    /**
     * Application: left right
     */
    record Application(Term left, Term right) implements Term {
        public Application {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R fold(Function<Variable, R> onVariable,
                          Function<Abstraction, R> onAbstraction,
                          Function<Application, R> onApplication) {
            return onApplication.apply(this);
        }
    }

    private static void requireName(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Variable name must not be empty");
        }
    }
}
