package io.formrules.core.engine;

import io.formrules.core.model.BoundRule;
import io.formrules.core.model.FieldRules;
import io.formrules.core.model.RuleSet;
import io.formrules.core.model.ValidationResult;
import io.formrules.core.model.Violation;
import io.formrules.core.path.WalkContext;
import io.formrules.core.rule.RequiredRule;
import io.formrules.core.spi.RuleContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a {@link RuleSet} against a form.
 *
 * <p>Fields are validated in declaration order. The path of each field is walked over the form;
 * array steps fan out so that every element is validated on its own and reported under its exact
 * path ({@code attendees[1].email}). For each value reached:
 *
 * <ul>
 *   <li>absent, or {@code null} without {@code nullable}: only {@code required} applies, and fails;
 *   <li>{@code null} with {@code nullable}: the value passes;
 *   <li>otherwise every rule runs in declaration order and every failing rule is reported. Rules
 *       may replace the value in the form, and later rules see the replaced value.
 * </ul>
 *
 * <p>The form is modified in place. Thread-safe as long as each form is validated by one thread.
 */
public final class Validator {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    /**
     * Validates {@code form} against {@code ruleSet}.
     *
     * @param ruleSet the rules to apply
     * @param form    the submitted data, mutable, coerced in place
     * @return the violations found, never null
     */
    public ValidationResult validate(RuleSet ruleSet, Map<String, Object> form) {
        Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        Objects.requireNonNull(form, "form must not be null");

        List<Violation> violations = new ArrayList<>();
        for (FieldRules field : ruleSet.fields()) {
            field.path().walk(form, context -> validateValue(ruleSet, field, context, form, violations));
        }
        return new ValidationResult(ruleSet.id(), violations, form);
    }

    private void validateValue(
            RuleSet ruleSet,
            FieldRules field,
            WalkContext context,
            Map<String, Object> form,
            List<Violation> violations) {
        if (context.notFound() || context.value() == null) {
            if (!context.notFound() && field.isNullable()) {
                return;
            }
            if (field.isRequired()) {
                report(ruleSet, context.path().toString(), RequiredRule.NAME, List.of(), violations);
            }
            return;
        }

        Object value = context.value();
        for (BoundRule rule : field.rules()) {
            RuleContext ruleContext = RuleContext.of(context, value, rule.parameters(), form);
            if (!rule.rule().validate(ruleContext)) {
                report(ruleSet, ruleContext.path(), rule.name(), rule.parameters(), violations);
            }
            value = ruleContext.value();
        }
    }

    private void report(
            RuleSet ruleSet, String path, String rule, List<String> parameters, List<Violation> violations) {
        LOG.debug("Rule set '{}': '{}' failed rule '{}' {}", ruleSet.id(), path, rule, parameters);
        violations.add(new Violation(path, rule, parameters));
    }
}
