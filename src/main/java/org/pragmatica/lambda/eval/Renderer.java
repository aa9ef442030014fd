package org.pragmatica.lambda.eval;

import org.pragmatica.lambda.tree.Term;

/**
 * Canonical text form of terms.
 *
 * <ul>
 *   <li>Variable: {@code x}</li>
 *   <li>Abstraction: {@code (λx.body)}</li>
 *   <li>Application: {@code left right}, with {@code right} parenthesized unless it is a variable</li>
 * </ul>
 */
public final class Renderer {
    private static final int DEFAULT_CAPACITY = 64;

    private Renderer() {}

    public static String render(Term term) {
        var sb = new StringBuilder(DEFAULT_CAPACITY);
        render(term, sb);
        return sb.toString();
    }

    private static void render(Term term, StringBuilder sb) {
        term.<Void>fold(variable -> {
                            sb.append(variable.name());
                            return null;
                        },
                        abstraction -> {
                            sb.append("(λ")
                              .append(abstraction.parameter())
                              .append('.');
                            render(abstraction.body(), sb);
                            sb.append(')');
                            return null;
                        },
                        application -> {
                            render(application.left(), sb);
                            sb.append(' ');
                            if (application.right() instanceof Term.Variable) {
                                render(application.right(), sb);
                            } else {
                                sb.append('(');
                                render(application.right(), sb);
                                sb.append(')');
                            }
                            return null;
                        });
    }
}
