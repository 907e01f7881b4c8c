package io.formrules.core.rule;

import io.formrules.core.spi.ParameterCount;
import io.formrules.core.spi.Rule;
import io.formrules.core.spi.RuleContext;
import java.util.Optional;

/**
 * {@code in:a,b,...} and {@code not_in:a,b,...}: membership of the value's string form in the
 * parameter list. Only strings, numbers and booleans can be members; any other value fails both
 * rules.
 */
public final class InRule implements Rule {

    public static final String IN = "in";
    public static final String NOT_IN = "not_in";

    private final boolean negated;

    public InRule(boolean negated) {
        this.negated = negated;
    }

    @Override
    public boolean validate(RuleContext context) {
        Optional<String> value = Values.scalarString(context.value());
        if (value.isEmpty()) {
            return false;
        }
        return context.parameters().contains(value.get()) != negated;
    }

    @Override
    public ParameterCount parameterCount() {
        return ParameterCount.atLeast(1);
    }
}
