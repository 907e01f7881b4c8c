package io.formrules.core.rule;

import io.formrules.core.spi.ParameterCount;
import io.formrules.core.spi.Rule;
import io.formrules.core.spi.RuleContext;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * {@code integer}: the value must be an integral number, or a string holding one, that fits in a
 * {@code long}. The value is replaced by its {@link Long} form.
 */
public final class IntegerRule implements Rule {

    public static final String NAME = "integer";

    @Override
    public boolean validate(RuleContext context) {
        Object value = context.value();
        if (!(value instanceof Number) && !(value instanceof String)) {
            return false;
        }
        Optional<BigDecimal> decimal = Values.toDecimal(value);
        if (decimal.isEmpty()) {
            return false;
        }
        long coerced;
        try {
            coerced = decimal.get().longValueExact();
        } catch (ArithmeticException e) {
            return false; // fractional part or out of range
        }
        context.replaceValue(coerced);
        return true;
    }

    @Override
    public ParameterCount parameterCount() {
        return ParameterCount.none();
    }
}
