package io.formrules.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A rule as written in a rule set: its name and its ordered string parameters. The textual form
 * is {@code name} or {@code name:p1,p2,...}, for example {@code date_between:2023-01-01,2023-12-31}.
 *
 * @param name       the rule name
 * @param parameters the parameters, possibly empty
 */
public record RuleDeclaration(String name, List<String> parameters) {

    public RuleDeclaration {
        Objects.requireNonNull(name, "name must not be null");
        parameters = List.copyOf(parameters);
    }

    /** Creates a declaration from a name and parameters given separately. */
    public static RuleDeclaration of(String name, String... parameters) {
        return new RuleDeclaration(name, Arrays.asList(parameters));
    }

    /**
     * Parses the textual form. Surrounding whitespace is trimmed from the name and from each
     * parameter. A trailing {@code ':'} with nothing after it means no parameters.
     *
     * @throws IllegalArgumentException if the rule name is empty
     */
    public static RuleDeclaration parse(String text) {
        Objects.requireNonNull(text, "rule declaration must not be null");
        int colon = text.indexOf(':');
        String name = (colon < 0 ? text : text.substring(0, colon)).trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("empty rule name in declaration '" + text + "'");
        }
        List<String> parameters = new ArrayList<>();
        if (colon >= 0 && colon < text.length() - 1) {
            for (String parameter : text.substring(colon + 1).split(",", -1)) {
                parameters.add(parameter.trim());
            }
        }
        return new RuleDeclaration(name, parameters);
    }

    @Override
    public String toString() {
        return parameters.isEmpty() ? name : name + ":" + String.join(",", parameters);
    }
}
