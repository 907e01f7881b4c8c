package io.formrules.core.rule;

import io.formrules.core.spi.ParameterCount;
import io.formrules.core.spi.Rule;
import io.formrules.core.spi.RuleContext;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code min:n}, {@code max:n}, {@code between:min,max} and {@code size:n}. Numbers are compared by
 * value, strings by length in code points, lists and maps by element count. Declare
 * {@code numeric} or {@code integer} first to compare numeric strings by value.
 */
public final class SizeRule implements Rule {

    /** Supported bounds and their rule names. */
    public enum Bound {
        MIN("min", 1),
        MAX("max", 1),
        BETWEEN("between", 2),
        SIZE("size", 1);

        private final String ruleName;
        private final int parameters;

        Bound(String ruleName, int parameters) {
            this.ruleName = ruleName;
            this.parameters = parameters;
        }

        public String ruleName() {
            return ruleName;
        }
    }

    private final Bound bound;

    public SizeRule(Bound bound) {
        this.bound = bound;
    }

    @Override
    public boolean validate(RuleContext context) {
        Optional<BigDecimal> size = Values.size(context.value());
        if (size.isEmpty()) {
            return false;
        }
        List<BigDecimal> limits = new ArrayList<>(context.parameters().size());
        for (String parameter : context.parameters()) {
            Optional<BigDecimal> limit = Values.parseDecimal(parameter);
            if (limit.isEmpty()) {
                return false;
            }
            limits.add(limit.get());
        }
        BigDecimal actual = size.get();
        return switch (bound) {
            case MIN -> actual.compareTo(limits.get(0)) >= 0;
            case MAX -> actual.compareTo(limits.get(0)) <= 0;
            case BETWEEN -> actual.compareTo(limits.get(0)) >= 0 && actual.compareTo(limits.get(1)) <= 0;
            case SIZE -> actual.compareTo(limits.get(0)) == 0;
        };
    }

    @Override
    public ParameterCount parameterCount() {
        return ParameterCount.exactly(bound.parameters);
    }

    @Override
    public void checkParameters(List<String> parameters) {
        for (String parameter : parameters) {
            if (Values.parseDecimal(parameter).isEmpty()) {
                throw new IllegalArgumentException("'" + parameter + "' is not a number");
            }
        }
        if (bound == Bound.BETWEEN
                && Values.parseDecimal(parameters.get(0))
                                .get()
                                .compareTo(Values.parseDecimal(parameters.get(1)).get())
                        > 0) {
            throw new IllegalArgumentException("lower bound " + parameters.get(0) + " exceeds upper bound "
                    + parameters.get(1));
        }
    }
}
