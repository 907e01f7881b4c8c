package io.formrules.core.engine;

import io.formrules.core.error.UnknownRuleSetException;
import io.formrules.core.model.RuleSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of all loaded rule sets.
 *
 * <p>This is the unit of atomic swap in {@link ValidationEngine#reload}. In-flight validations
 * that captured the old snapshot finish with it; new validations pick up the new one.
 *
 * <p>Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class RuleSetRegistry {

    private final Map<String, RuleSet> ruleSets;

    /**
     * Creates a registry holding the given rule sets. The map is defensively copied.
     *
     * @param ruleSets rule sets keyed by id
     */
    public RuleSetRegistry(Map<String, RuleSet> ruleSets) {
        this.ruleSets = Collections.unmodifiableMap(new LinkedHashMap<>(ruleSets));
    }

    /** Creates an empty registry. */
    public static RuleSetRegistry empty() {
        return new RuleSetRegistry(Map.of());
    }

    /** Returns a new {@link Builder}. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-filled with this registry's rule sets. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        ruleSets.values().forEach(builder::add);
        return builder;
    }

    /** Looks up a rule set by id, or returns null. */
    public RuleSet getRuleSet(String id) {
        return ruleSets.get(id);
    }

    /**
     * Looks up a rule set by id, throwing if it is not loaded.
     *
     * @throws UnknownRuleSetException if no rule set has that id
     */
    public RuleSet requireRuleSet(String id) {
        RuleSet ruleSet = ruleSets.get(id);
        if (ruleSet == null) {
            throw new UnknownRuleSetException(
                    "No rule set loaded with id '" + id + "', loaded: " + ruleSets.keySet(), id);
        }
        return ruleSet;
    }

    /** Ids of the loaded rule sets, in load order. */
    public Set<String> ids() {
        return ruleSets.keySet();
    }

    public int size() {
        return ruleSets.size();
    }

    /** Builder for constructing a {@link RuleSetRegistry} incrementally. */
    public static final class Builder {

        private final Map<String, RuleSet> ruleSets = new LinkedHashMap<>();

        Builder() {}

        /** Adds a rule set, replacing any rule set with the same id. */
        public Builder add(RuleSet ruleSet) {
            ruleSets.put(ruleSet.id(), ruleSet);
            return this;
        }

        public RuleSetRegistry build() {
            return new RuleSetRegistry(ruleSets);
        }
    }
}
