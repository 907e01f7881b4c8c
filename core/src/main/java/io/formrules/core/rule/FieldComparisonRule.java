package io.formrules.core.rule;

import io.formrules.core.spi.ParameterCount;
import io.formrules.core.spi.Rule;
import io.formrules.core.spi.RuleContext;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@code same:field} and {@code different:field}: compares the value with another field of the
 * form. Numbers compare by value whatever their representation. {@code different} passes when the
 * other field is absent; {@code same} fails.
 */
public final class FieldComparisonRule implements Rule {

    public static final String SAME = "same";
    public static final String DIFFERENT = "different";

    private final boolean expectSame;

    public FieldComparisonRule(boolean expectSame) {
        this.expectSame = expectSame;
    }

    @Override
    public boolean validate(RuleContext context) {
        Optional<FormFields.FieldValue> other =
                FormFields.lookup(context.form(), context.parameters().get(0));
        if (other.isEmpty()) {
            return !expectSame;
        }
        return Values.sameValue(context.value(), other.get().value()) == expectSame;
    }

    @Override
    public ParameterCount parameterCount() {
        return ParameterCount.exactly(1);
    }

    @Override
    public void checkParameters(List<String> parameters) {
        if (!FormFields.isReference(parameters.get(0))) {
            throw new IllegalArgumentException("'" + parameters.get(0) + "' is not a field path without arrays");
        }
    }

    @Override
    public Set<String> referencedFields(List<String> parameters) {
        return Set.of(parameters.get(0));
    }
}
