package io.formrules.core.rule;

import io.formrules.core.spi.ParameterCount;
import io.formrules.core.spi.Rule;
import io.formrules.core.spi.RuleContext;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * {@code date[:layout]}: the value must be a string matching the layout ({@code uuuu-MM-dd} by
 * default). On success the string is replaced in the form by the parsed {@link OffsetDateTime},
 * which is what the date comparison rules declared after it operate on. On failure the value is
 * left untouched.
 */
public final class DateRule implements Rule {

    public static final String NAME = "date";

    @Override
    public boolean validate(RuleContext context) {
        String layout = context.parameters().isEmpty()
                ? DateLayouts.DEFAULT_DATE_LAYOUT
                : context.parameters().get(0);
        Optional<OffsetDateTime> parsed = DateLayouts.parse(context.value(), layout);
        if (parsed.isEmpty()) {
            return false;
        }
        context.replaceValue(parsed.get());
        return true;
    }

    @Override
    public ParameterCount parameterCount() {
        return ParameterCount.atMost(1);
    }

    @Override
    public void checkParameters(List<String> parameters) {
        if (!parameters.isEmpty()) {
            DateLayouts.formatter(parameters.get(0));
        }
    }
}
