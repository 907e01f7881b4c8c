package io.formrules.core.rule;

import io.formrules.core.spi.ParameterCount;
import io.formrules.core.spi.Rule;
import io.formrules.core.spi.RuleContext;
import java.util.Collection;
import java.util.Map;

/**
 * {@code required}: the field must be present and hold something. Blank strings and empty lists
 * or maps do not count. Absent and {@code null} values are reported by the validator without
 * calling the rule.
 */
public final class RequiredRule implements Rule {

    public static final String NAME = "required";

    @Override
    public boolean validate(RuleContext context) {
        Object value = context.value();
        if (value == null) {
            return false;
        }
        if (value instanceof String text) {
            return !text.isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    @Override
    public ParameterCount parameterCount() {
        return ParameterCount.none();
    }
}
