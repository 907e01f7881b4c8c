package io.formrules.core.rule;

import io.formrules.core.spi.ParameterCount;
import io.formrules.core.spi.Rule;
import io.formrules.core.spi.RuleContext;
import java.util.Locale;
import java.util.Set;

/**
 * {@code boolean}: accepts booleans, the numbers {@code 1} and {@code 0}, and the strings
 * {@code true/false}, {@code 1/0}, {@code on/off}, {@code yes/no} (case-insensitive). The value is
 * replaced by its {@link Boolean} form.
 */
public final class BooleanRule implements Rule {

    public static final String NAME = "boolean";

    private static final Set<String> TRUE_STRINGS = Set.of("true", "1", "on", "yes");
    private static final Set<String> FALSE_STRINGS = Set.of("false", "0", "off", "no");

    @Override
    public boolean validate(RuleContext context) {
        Object value = context.value();
        if (value instanceof Boolean) {
            return true;
        }
        Boolean coerced = null;
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if (TRUE_STRINGS.contains(normalized)) {
                coerced = Boolean.TRUE;
            } else if (FALSE_STRINGS.contains(normalized)) {
                coerced = Boolean.FALSE;
            }
        } else if (value instanceof Number) {
            String normalized = Values.scalarString(value).orElse("");
            if ("1".equals(normalized)) {
                coerced = Boolean.TRUE;
            } else if ("0".equals(normalized)) {
                coerced = Boolean.FALSE;
            }
        }
        if (coerced == null) {
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
