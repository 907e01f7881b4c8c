package io.formrules.core.rule;

import io.formrules.core.spi.ParameterCount;
import io.formrules.core.spi.Rule;
import io.formrules.core.spi.RuleContext;

/**
 * {@code nullable}: marker allowing an explicit {@code null}. When the value is {@code null} the
 * validator skips the field's other rules; the rule itself always passes.
 */
public final class NullableRule implements Rule {

    public static final String NAME = "nullable";

    @Override
    public boolean validate(RuleContext context) {
        return true;
    }

    @Override
    public ParameterCount parameterCount() {
        return ParameterCount.none();
    }
}
