package org.pragmatica.lambda.repl;

import org.pragmatica.lambda.LambdaCalculus;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered table of named terms, expanded textually before parsing.
 */
public final class Definitions {
    private static final Pattern WORD = Pattern.compile("[A-Za-z0-9]+");

    private final LambdaCalculus lambda;
    private final Map<String, String> entries = new LinkedHashMap<>();

    private Definitions(LambdaCalculus lambda) {
        this.lambda = lambda;
    }

    /**
     * Create an empty table.
     */
    public static Definitions empty(LambdaCalculus lambda) {
        return new Definitions(Objects.requireNonNull(lambda, "lambda"));
    }

    /**
     * Create a table seeded with Church booleans, numerals and common combinators.
     */
    public static Definitions withPredefined(LambdaCalculus lambda) {
        var definitions = empty(lambda);
        definitions.addPredefined();
        return definitions;
    }

    private void addPredefined() {
        // Church booleans
        entries.put("true", "\\x.\\y.x");
        entries.put("false", "\\x.\\y.y");
        // Church numerals
        entries.put("0", "\\f.\\x.x");
        entries.put("1", "\\f.\\x.f x");
        entries.put("2", "\\f.\\x.f (f x)");
        entries.put("3", "\\f.\\x.f (f (f x))");
        // Combinators
        entries.put("I", "\\x.x");
        entries.put("K", "\\x.\\y.x");
        entries.put("S", "\\x.\\y.\\z.x z (y z)");
        entries.put("Y", "\\f.(\\x.f (x x)) (\\x.f (x x))");
        // Boolean operations
        entries.put("and", "\\p.\\q.p q p");
        entries.put("or", "\\p.\\q.p p q");
        entries.put("not", "\\p.\\a.\\b.p b a");
    }

    /**
     * Bind {@code name} to {@code text}, replacing any earlier binding.
     * The text is stored as written but must parse once expanded.
     *
     * @throws IllegalArgumentException if {@code name} is not a word of letters and digits
     * @throws org.pragmatica.lambda.error.LambdaError if the expanded text does not parse
     */
    public void define(String name, String text) {
        if (!WORD.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid definition name: '" + name + "'");
        }
        lambda.parse(expand(text));
        entries.put(name, text);
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    /**
     * Replace whole-word occurrences of defined names by their parenthesized definitions.
     * Names inside definitions are resolved against the current table when expanded, so
     * redefining a name affects every definition that refers to it.
     */
    public String expand(String text) {
        return expand(text, new HashSet<>());
    }

    private String expand(String text, Set<String> expanding) {
        return WORD.matcher(text)
                   .replaceAll(match -> Matcher.quoteReplacement(resolve(match.group(), expanding)));
    }

    private String resolve(String word, Set<String> expanding) {
        var definition = entries.get(word);
        // Self-reference stays a free variable
        if (definition == null || expanding.contains(word)) {
            return word;
        }
        expanding.add(word);
        var expanded = "(" + expand(definition, expanding) + ")";
        expanding.remove(word);
        return expanded;
    }

    /**
     * Drop all user definitions and restore the predefined ones.
     */
    public void reset() {
        entries.clear();
        addPredefined();
    }

    /**
     * Read-only view in definition order.
     */
    public Map<String, String> entries() {
        return Collections.unmodifiableMap(entries);
    }
}
