package io.formrules.core.rule;

import io.formrules.core.error.UnknownRuleException;
import io.formrules.core.spi.Rule;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of validation rules by name. Rule sets resolve their declarations against a registry
 * when they are built. Thread-safe: registration and lookup can happen concurrently.
 */
public final class RuleRegistry {

    private final Map<String, Rule> rules = new ConcurrentHashMap<>();

    /** Creates a registry holding every built-in rule. */
    public static RuleRegistry withDefaults() {
        RuleRegistry registry = new RuleRegistry();
        registry.register(RequiredRule.NAME, new RequiredRule());
        registry.register(NullableRule.NAME, new NullableRule());
        for (TypeRule.Type type : TypeRule.Type.values()) {
            registry.register(type.ruleName(), new TypeRule(type));
        }
        registry.register(NumericRule.NAME, new NumericRule());
        registry.register(IntegerRule.NAME, new IntegerRule());
        registry.register(BooleanRule.NAME, new BooleanRule());
        for (SizeRule.Bound bound : SizeRule.Bound.values()) {
            registry.register(bound.ruleName(), new SizeRule(bound));
        }
        registry.register(InRule.IN, new InRule(false));
        registry.register(InRule.NOT_IN, new InRule(true));
        registry.register(FieldComparisonRule.SAME, new FieldComparisonRule(true));
        registry.register(FieldComparisonRule.DIFFERENT, new FieldComparisonRule(false));
        registry.register(DateRule.NAME, new DateRule());
        for (DateComparisonRule.Comparison comparison : DateComparisonRule.Comparison.values()) {
            registry.register(comparison.ruleName(), new DateComparisonRule(comparison));
        }
        return registry;
    }

    /**
     * Registers a rule. If a rule with the same name is already registered, it is replaced
     * (last-write-wins semantics).
     *
     * @param name the name used in declarations, e.g. {@code "before"}
     * @param rule the rule implementation
     * @throws NullPointerException     if name or rule is null
     * @throws IllegalArgumentException if name is empty or contains {@code ':'}, {@code ','} or
     *                                  {@code '|'}
     */
    public void register(String name, Rule rule) {
        if (name == null) {
            throw new NullPointerException("rule name must not be null");
        }
        if (rule == null) {
            throw new NullPointerException("rule must not be null");
        }
        if (name.isBlank() || name.indexOf(':') >= 0 || name.indexOf(',') >= 0 || name.indexOf('|') >= 0) {
            throw new IllegalArgumentException("invalid rule name: '" + name + "'");
        }
        rules.put(name, rule);
    }

    /**
     * Looks up a rule by name.
     *
     * @return the rule, or empty if not registered
     */
    public Optional<Rule> getRule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    /**
     * Looks up a rule by name, throwing if not found.
     *
     * @throws UnknownRuleException if no rule is registered under that name
     */
    public Rule requireRule(String name) {
        return getRule(name)
                .orElseThrow(() ->
                        new UnknownRuleException("No rule registered for name: '" + name + "'", name, null, null));
    }

    /** Returns {@code true} if a rule with the given name is registered. */
    public boolean hasRule(String name) {
        return rules.containsKey(name);
    }

    /** Returns the registered rule names, sorted. */
    public Set<String> names() {
        return new TreeSet<>(rules.keySet());
    }

    /** Returns the number of registered rules. */
    public int size() {
        return rules.size();
    }
}
