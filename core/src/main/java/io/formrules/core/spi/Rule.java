package io.formrules.core.spi;

import java.util.List;
import java.util.Set;

/**
 * A named validation rule. Implementations receive the value of one field together with the
 * parameters of the declaration and the whole submitted form, and answer pass or fail. A rule may
 * replace the value in the form through {@link RuleContext#replaceValue(Object)}; rules declared
 * after it on the same field then see the replaced value.
 *
 * <p>Implementations MUST be stateless and thread-safe: one instance serves every rule set and
 * every concurrent validation.
 */
@FunctionalInterface
public interface Rule {

    /**
     * Validates the value held by the context.
     *
     * @return {@code true} if the value passes. Malformed input makes the rule fail, it never
     *     raises an exception.
     */
    boolean validate(RuleContext context);

    /** Parameter count accepted by this rule. Checked once per declaration at build time. */
    default ParameterCount parameterCount() {
        return ParameterCount.any();
    }

    /**
     * Rule-specific parameter check performed at build time after the count check.
     *
     * @throws IllegalArgumentException if the parameters can never be satisfied
     */
    default void checkParameters(List<String> parameters) {}

    /**
     * Parameters of the declaration that name other fields of the form. Each one must be declared
     * in the same rule set.
     */
    default Set<String> referencedFields(List<String> parameters) {
        return Set.of();
    }

    /**
     * Rules expected to run earlier on the same field, e.g. {@code date} before a date comparison.
     * A missing predecessor is reported as a warning only, since the value may already be typed.
     */
    default Set<String> expectedPredecessors() {
        return Set.of();
    }
}
