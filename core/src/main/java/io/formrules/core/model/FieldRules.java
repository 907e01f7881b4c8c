package io.formrules.core.model;

import io.formrules.core.path.Path;
import io.formrules.core.rule.NullableRule;
import io.formrules.core.rule.RequiredRule;
import java.util.List;
import java.util.Objects;

/**
 * The ordered rules declared for one field path. Order matters: rules that coerce a value (such
 * as {@code date}) must come before the rules that read the coerced value.
 *
 * @param field the path as declared, e.g. {@code attendees[].email}
 * @param path  the parsed path
 * @param rules the resolved rules, in declaration order
 */
public record FieldRules(String field, Path path, List<BoundRule> rules) {

    public FieldRules {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(path, "path must not be null");
        rules = List.copyOf(rules);
    }

    /** Returns {@code true} if the field declares {@code required}. */
    public boolean isRequired() {
        return declares(RequiredRule.NAME);
    }

    /** Returns {@code true} if the field declares {@code nullable}. */
    public boolean isNullable() {
        return declares(NullableRule.NAME);
    }

    /** Returns {@code true} if a rule with the given name is declared for this field. */
    public boolean declares(String ruleName) {
        for (BoundRule rule : rules) {
            if (rule.name().equals(ruleName)) {
                return true;
            }
        }
        return false;
    }
}
