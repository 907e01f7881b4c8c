package io.formrules.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One failed rule on one value.
 *
 * @param path       exact path of the value, e.g. {@code attendees[2].email}
 * @param rule       name of the rule that failed
 * @param parameters parameters of the failed declaration
 */
public record Violation(String path, String rule, List<String> parameters) {

    public Violation {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        parameters = List.copyOf(parameters);
    }
}
