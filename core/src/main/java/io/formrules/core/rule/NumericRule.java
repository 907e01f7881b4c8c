package io.formrules.core.rule;

import io.formrules.core.spi.ParameterCount;
import io.formrules.core.spi.Rule;
import io.formrules.core.spi.RuleContext;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * {@code numeric}: the value must be a number or a string holding one. Strings are replaced by
 * their {@link Double} value; numbers are left as they are.
 */
public final class NumericRule implements Rule {

    public static final String NAME = "numeric";

    @Override
    public boolean validate(RuleContext context) {
        Object value = context.value();
        if (value instanceof Number) {
            return Values.toDecimal(value).isPresent();
        }
        if (!(value instanceof String text)) {
            return false;
        }
        Optional<BigDecimal> parsed = Values.parseDecimal(text);
        if (parsed.isEmpty()) {
            return false;
        }
        double coerced = parsed.get().doubleValue();
        if (!Double.isFinite(coerced)) {
            return false;
        }
        context.replaceValue(coerced);
        return true;
    }

    @Override
    public ParameterCount parameterCount() {
        return ParameterCount.none();
    }
}
