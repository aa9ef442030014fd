package org.pragmatica.lambda.eval;

import org.pragmatica.lambda.error.NonTermination;
import org.pragmatica.lambda.tree.Term;
import org.pragmatica.lambda.tree.Term.Abstraction;
import org.pragmatica.lambda.tree.Term.Application;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Normal-order evaluator based on capture-avoiding substitution.
 *
 * <p>The evaluator holds no mutable state; a single instance may be shared freely.
 * Traversals are recursive, so very deeply nested terms may exhaust the call stack.
 */
public final class Evaluator {
    private final EvaluatorConfig config;

    private Evaluator(EvaluatorConfig config) {
        this.config = config;
    }

    public static Evaluator create() {
        return create(EvaluatorConfig.DEFAULT);
    }

    public static Evaluator create(EvaluatorConfig config) {
        return new Evaluator(config);
    }

    public EvaluatorConfig config() {
        return config;
    }

    /**
     * Check whether {@code name} occurs in {@code term} outside any abstraction binding it.
     */
    public boolean isFree(String name, Term term) {
        return term.<Boolean>fold(variable -> variable.name().equals(name),
                                  abstraction -> !abstraction.parameter().equals(name)
                                                 && isFree(name, abstraction.body()),
                                  application -> isFree(name, application.left())
                                                 || isFree(name, application.right()));
    }

    /**
     * Derive a name from {@code base} that is not free in {@code term} by appending the configured suffix.
     */
    public String freshName(String base, Term term) {
        var candidate = base + config.freshSuffix();
        while (isFree(candidate, term)) {
            candidate += config.freshSuffix();
        }
        return candidate;
    }

    /**
     * Replace every free occurrence of {@code name} in {@code term} with {@code replacement},
     * renaming binders that would capture free variables of {@code replacement}.
     * Untouched subtrees are shared with the input.
     */
    public Term substitute(Term term, String name, Term replacement) {
        return term.<Term>fold(variable -> variable.name().equals(name)
                                           ? replacement
                                           : variable,
                               abstraction -> substituteInAbstraction(abstraction, name, replacement),
                               application -> substituteInApplication(application, name, replacement));
    }

    private Term substituteInAbstraction(Abstraction abstraction, String name, Term replacement) {
        var parameter = abstraction.parameter();
        var body = abstraction.body();

        // Binder shadows the target
        if (parameter.equals(name)) {
            return abstraction;
        }

        if (isFree(parameter, replacement) && isFree(name, body)) {
            var fresh = freshName(parameter, Term.application(replacement, body));
            var renamed = substitute(body, parameter, Term.variable(fresh));
            return Term.abstraction(fresh, substitute(renamed, name, replacement));
        }

        var newBody = substitute(body, name, replacement);
        return newBody == body
               ? abstraction
               : Term.abstraction(parameter, newBody);
    }

    private Term substituteInApplication(Application application, String name, Term replacement) {
        var left = substitute(application.left(), name, replacement);
        var right = substitute(application.right(), name, replacement);
        return left == application.left() && right == application.right()
               ? application
               : Term.application(left, right);
    }

    /**
     * Perform one reduction step in normal order.
     *
     * @return the reduced term, or empty if {@code term} is in normal form
     */
    public Optional<Term> step(Term term) {
        return term.<Optional<Term>>fold(variable -> Optional.empty(),
                                         this::stepAbstraction,
                                         this::stepApplication);
    }

    private Optional<Term> stepAbstraction(Abstraction abstraction) {
        return step(abstraction.body())
            .map(body -> Term.abstraction(abstraction.parameter(), body));
    }

    private Optional<Term> stepApplication(Application application) {
        var left = step(application.left());
        if (left.isPresent()) {
            return Optional.of(Term.application(left.get(), application.right()));
        }

        var right = step(application.right());
        if (right.isPresent()) {
            return Optional.of(Term.application(application.left(), right.get()));
        }

        if (application.left() instanceof Abstraction function) {
            return Optional.of(betaReduce(function, application.right()));
        }

        // Stuck: head is a variable or an irreducible application
        return Optional.empty();
    }

    private Term betaReduce(Abstraction function, Term argument) {
        return substitute(function.body(), function.parameter(), argument);
    }

    /**
     * Reduce to normal form within the configured step budget.
     *
     * @throws NonTermination if the budget is used up
     */
    public Term evaluate(Term term) {
        return evaluate(term, config.maxSteps());
    }

    /**
     * Reduce to normal form within {@code maxSteps} reductions.
     *
     * @throws NonTermination if {@code maxSteps} reductions were performed without reaching normal form
     */
    public Term evaluate(Term term, int maxSteps) {
        EvaluatorConfig.requirePositive(maxSteps);
        var current = term;

        for (int steps = 0; steps < maxSteps; steps++) {
            var next = step(current);
            if (next.isEmpty()) {
                return current;
            }
            current = next.get();
        }
        throw new NonTermination(maxSteps);
    }

    /**
     * Reduce to normal form within the configured step budget, recording every intermediate term.
     */
    public EvaluationTrace trace(Term term) {
        return trace(term, config.maxSteps());
    }

    /**
     * Reduce to normal form within {@code maxSteps} reductions, recording every intermediate term.
     * The trace is never truncated: if the budget runs out the whole call fails.
     *
     * @throws NonTermination if {@code maxSteps} reductions were performed without reaching normal form
     */
    public EvaluationTrace trace(Term term, int maxSteps) {
        EvaluatorConfig.requirePositive(maxSteps);
        var steps = new ArrayList<String>();
        var current = term;
        steps.add(Renderer.render(current));

        for (int count = 0; count < maxSteps; count++) {
            var next = step(current);
            if (next.isEmpty()) {
                return new EvaluationTrace(current, steps);
            }
            current = next.get();
            steps.add(Renderer.render(current));
        }
        throw new NonTermination(maxSteps);
    }
}
