package io.formrules.core.rule;

import io.formrules.core.spi.ParameterCount;
import io.formrules.core.spi.Rule;
import io.formrules.core.spi.RuleContext;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares a date value, already coerced by {@code date}, with one or two other dates.
 *
 * <p>Each parameter is resolved as follows:
 *
 * <ul>
 *   <li>if the form has a field of that name, its value is used: as is when already a date,
 *       otherwise parsed with {@link DateLayouts#DEFAULT_DATE_LAYOUT};
 *   <li>otherwise the parameter itself is parsed with {@link DateLayouts#LITERAL_DATE_TIME}.
 * </ul>
 *
 * <p>The rule fails closed: a value that is not a date, or a parameter that cannot be resolved to
 * a date, makes the rule fail.
 */
public final class DateComparisonRule implements Rule {

    private static final Logger LOG = LoggerFactory.getLogger(DateComparisonRule.class);

    /** Supported comparisons and their rule names. */
    public enum Comparison {
        BEFORE("before", 1) {
            @Override
            boolean test(OffsetDateTime value, List<OffsetDateTime> others) {
                return value.isBefore(others.get(0));
            }
        },
        BEFORE_EQUAL("before_equal", 1) {
            @Override
            boolean test(OffsetDateTime value, List<OffsetDateTime> others) {
                return !value.isAfter(others.get(0));
            }
        },
        AFTER("after", 1) {
            @Override
            boolean test(OffsetDateTime value, List<OffsetDateTime> others) {
                return value.isAfter(others.get(0));
            }
        },
        AFTER_EQUAL("after_equal", 1) {
            @Override
            boolean test(OffsetDateTime value, List<OffsetDateTime> others) {
                return !value.isBefore(others.get(0));
            }
        },
        DATE_EQUALS("date_equals", 1) {
            @Override
            boolean test(OffsetDateTime value, List<OffsetDateTime> others) {
                return value.isEqual(others.get(0));
            }
        },
        DATE_BETWEEN("date_between", 2) {
            @Override
            boolean test(OffsetDateTime value, List<OffsetDateTime> others) {
                return !value.isBefore(others.get(0)) && !value.isAfter(others.get(1));
            }
        };

        private final String ruleName;
        private final int parameters;

        Comparison(String ruleName, int parameters) {
            this.ruleName = ruleName;
            this.parameters = parameters;
        }

        public String ruleName() {
            return ruleName;
        }

        abstract boolean test(OffsetDateTime value, List<OffsetDateTime> others);
    }

    private final Comparison comparison;

    public DateComparisonRule(Comparison comparison) {
        this.comparison = comparison;
    }

    public Comparison comparison() {
        return comparison;
    }

    @Override
    public boolean validate(RuleContext context) {
        if (!(context.value() instanceof OffsetDateTime value)) {
            return false;
        }
        List<OffsetDateTime> others = new ArrayList<>(context.parameters().size());
        for (String parameter : context.parameters()) {
            Optional<OffsetDateTime> other = resolve(parameter, context);
            if (other.isEmpty()) {
                return false;
            }
            others.add(other.get());
        }
        return comparison.test(value, others);
    }

    private Optional<OffsetDateTime> resolve(String parameter, RuleContext context) {
        Optional<FormFields.FieldValue> field = FormFields.lookup(context.form(), parameter);
        if (field.isPresent()) {
            Object other = field.get().value();
            if (other instanceof OffsetDateTime date) {
                return Optional.of(date);
            }
            // Referenced field not validated yet, or validated after this one
            return DateLayouts.parse(other, DateLayouts.DEFAULT_DATE_LAYOUT);
        }

        Optional<OffsetDateTime> literal = DateLayouts.parseLiteral(parameter);
        if (literal.isEmpty()) {
            LOG.warn(
                    "{} on '{}': parameter '{}' is neither a field of the form nor a date literal",
                    comparison.ruleName(),
                    context.path(),
                    parameter);
        }
        return literal;
    }

    @Override
    public ParameterCount parameterCount() {
        return ParameterCount.exactly(comparison.parameters);
    }

    @Override
    public void checkParameters(List<String> parameters) {
        for (String parameter : parameters) {
            if (DateLayouts.parseLiteral(parameter).isEmpty() && !FormFields.isReference(parameter)) {
                throw new IllegalArgumentException(
                        "'" + parameter + "' is neither a date literal nor a field path without arrays");
            }
        }
    }

    @Override
    public Set<String> referencedFields(List<String> parameters) {
        Set<String> fields = new LinkedHashSet<>();
        for (String parameter : parameters) {
            if (DateLayouts.parseLiteral(parameter).isEmpty()) {
                fields.add(parameter);
            }
        }
        return fields;
    }

    @Override
    public Set<String> expectedPredecessors() {
        return Set.of(DateRule.NAME);
    }
}
