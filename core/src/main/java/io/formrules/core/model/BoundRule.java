package io.formrules.core.model;

import io.formrules.core.spi.Rule;
import java.util.List;
import java.util.Objects;

/**
 * A declaration resolved against a {@link io.formrules.core.rule.RuleRegistry}.
 *
 * @param declaration the declaration as written
 * @param rule        the registered rule implementing it
 */
public record BoundRule(RuleDeclaration declaration, Rule rule) {

    public BoundRule {
        Objects.requireNonNull(declaration, "declaration must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
    }

    public String name() {
        return declaration.name();
    }

    public List<String> parameters() {
        return declaration.parameters();
    }
}
