package io.formrules.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of validating one form against one rule set. Failing rules are data, not exceptions: a
 * failing field never prevents the other fields from being validated.
 *
 * <p>The form is the same instance that was validated, carrying the values coerced by the rules
 * (dates, numbers, booleans).
 */
public final class ValidationResult {

    private final String ruleSetId;
    private final List<Violation> violations;
    private final Map<String, Object> form;

    public ValidationResult(String ruleSetId, List<Violation> violations, Map<String, Object> form) {
        this.ruleSetId = ruleSetId;
        this.violations = List.copyOf(violations);
        this.form = Objects.requireNonNull(form, "form must not be null");
    }

    public String ruleSetId() {
        return ruleSetId;
    }

    /** Returns {@code true} if no rule failed. */
    public boolean isValid() {
        return violations.isEmpty();
    }

    /** All violations, in validation order. */
    public List<Violation> violations() {
        return violations;
    }

    /** The validated form, with coerced values. */
    public Map<String, Object> form() {
        return form;
    }

    /** Names of the failed rules grouped by exact path, in validation order. */
    public Map<String, List<String>> failedRulesByPath() {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (Violation violation : violations) {
            grouped.computeIfAbsent(violation.path(), key -> new ArrayList<>()).add(violation.rule());
        }
        return Collections.unmodifiableMap(grouped);
    }

    /** Violations grouped by exact path, in validation order. */
    public Map<String, List<Violation>> violationsByPath() {
        Map<String, List<Violation>> grouped = new LinkedHashMap<>();
        for (Violation violation : violations) {
            grouped.computeIfAbsent(violation.path(), key -> new ArrayList<>()).add(violation);
        }
        return Collections.unmodifiableMap(grouped);
    }

    @Override
    public String toString() {
        return "ValidationResult[" + ruleSetId + ", " + (isValid() ? "VALID" : violations.size() + " violations")
                + "]";
    }
}
