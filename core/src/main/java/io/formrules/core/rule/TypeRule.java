package io.formrules.core.rule;

import io.formrules.core.spi.ParameterCount;
import io.formrules.core.spi.Rule;
import io.formrules.core.spi.RuleContext;
import java.util.List;
import java.util.Map;

/** {@code string}, {@code array} and {@code object}: checks the shape of the value, no coercion. */
public final class TypeRule implements Rule {

    /** Accepted shapes and their rule names. */
    public enum Type {
        STRING("string"),
        ARRAY("array"),
        OBJECT("object");

        private final String ruleName;

        Type(String ruleName) {
            this.ruleName = ruleName;
        }

        public String ruleName() {
            return ruleName;
        }
    }

    private final Type type;

    public TypeRule(Type type) {
        this.type = type;
    }

    @Override
    public boolean validate(RuleContext context) {
        Object value = context.value();
        return switch (type) {
            case STRING -> value instanceof String;
            case ARRAY -> value instanceof List;
            case OBJECT -> value instanceof Map;
        };
    }

    @Override
    public ParameterCount parameterCount() {
        return ParameterCount.none();
    }
}
