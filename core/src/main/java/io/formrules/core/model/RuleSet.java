package io.formrules.core.model;

import io.formrules.core.error.PathSyntaxException;
import io.formrules.core.error.RuleParameterException;
import io.formrules.core.error.RuleSetParseException;
import io.formrules.core.error.UnknownRuleException;
import io.formrules.core.path.Path;
import io.formrules.core.rule.RuleRegistry;
import io.formrules.core.spi.ParameterCount;
import io.formrules.core.spi.Rule;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A named, ordered set of field rules, built once and then shared read-only by every validation.
 *
 * <p>All configuration mistakes are detected by {@link Builder#build()} or earlier: malformed
 * paths, unknown rules, parameter counts, invalid parameters and references to undeclared fields.
 * A rule set that was built can be evaluated without configuration errors.
 */
public final class RuleSet {

    private final String id;
    private final String description;
    private final String source;
    private final List<FieldRules> fields;

    private RuleSet(String id, String description, String source, List<FieldRules> fields) {
        this.id = id;
        this.description = description;
        this.source = source;
        this.fields = List.copyOf(fields);
    }

    /**
     * Returns a builder resolving rule names against {@code registry}.
     *
     * @param id       rule set identifier
     * @param registry registry of available rules
     */
    public static Builder builder(String id, RuleRegistry registry) {
        return new Builder(id, registry);
    }

    public String id() {
        return id;
    }

    /** Optional human-readable description, may be null. */
    public String description() {
        return description;
    }

    /** File or resource the rule set was loaded from, or null if built in code. */
    public String source() {
        return source;
    }

    /** Field rules, in declaration order. */
    public List<FieldRules> fields() {
        return fields;
    }

    /** Looks up the rules declared for a path, as written in the declaration. */
    public Optional<FieldRules> field(String path) {
        for (FieldRules field : fields) {
            if (field.field().equals(path)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "RuleSet[" + id + ", fields=" + fields.size() + "]";
    }

    /** Builds a {@link RuleSet}, checking every declaration as it is added. */
    public static final class Builder {

        private static final Logger LOG = LoggerFactory.getLogger(RuleSet.class);

        private final String id;
        private final RuleRegistry registry;
        private final Map<String, FieldRules> fields = new LinkedHashMap<>();
        private String description;
        private String source;

        Builder(String id, RuleRegistry registry) {
            this.id = Objects.requireNonNull(id, "id must not be null");
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
        }

        /** Sets the description. */
        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /** Sets the source file reported in errors. */
        public Builder source(String source) {
            this.source = source;
            return this;
        }

        /**
         * Declares the rules of a field in textual form, e.g. {@code field("end", "date",
         * "after:start")}.
         */
        public Builder field(String path, String... declarations) {
            List<RuleDeclaration> parsed = new ArrayList<>(declarations.length);
            for (String declaration : declarations) {
                try {
                    parsed.add(RuleDeclaration.parse(declaration));
                } catch (IllegalArgumentException e) {
                    throw new RuleSetParseException(
                            "Field '" + path + "': " + e.getMessage(), e, id, source);
                }
            }
            return field(path, parsed);
        }

        /**
         * Declares the rules of a field.
         *
         * @throws PathSyntaxException     if the path is malformed
         * @throws RuleSetParseException   if the field is already declared
         * @throws UnknownRuleException    if a rule is not registered
         * @throws RuleParameterException  if a declaration has unacceptable parameters
         */
        public Builder field(String path, List<RuleDeclaration> declarations) {
            Objects.requireNonNull(path, "path must not be null");
            if (fields.containsKey(path)) {
                throw new RuleSetParseException("Field '" + path + "' is declared more than once", id, source);
            }
            Path parsedPath = parsePath(path);

            List<BoundRule> bound = new ArrayList<>(declarations.size());
            for (RuleDeclaration declaration : declarations) {
                Rule rule = resolve(path, declaration);
                warnOnMissingPredecessor(path, declaration, rule, bound);
                bound.add(new BoundRule(declaration, rule));
            }
            fields.put(path, new FieldRules(path, parsedPath, bound));
            return this;
        }

        /**
         * Builds the rule set.
         *
         * @throws RuleParameterException if a rule refers to a field the rule set does not declare
         */
        public RuleSet build() {
            for (FieldRules field : fields.values()) {
                for (BoundRule rule : field.rules()) {
                    Set<String> references = rule.rule().referencedFields(rule.parameters());
                    for (String reference : references) {
                        if (!fields.containsKey(reference)) {
                            throw new RuleParameterException(
                                    String.format(
                                            "Rule '%s' on field '%s' refers to '%s', which is neither a declared"
                                                    + " field nor a literal value",
                                            rule.declaration(), field.field(), reference),
                                    rule.name(),
                                    id,
                                    source);
                        }
                    }
                }
            }
            return new RuleSet(id, description, source, new ArrayList<>(fields.values()));
        }

        private Path parsePath(String path) {
            try {
                return Path.parse(path);
            } catch (PathSyntaxException e) {
                throw new PathSyntaxException(
                        "Rule set '" + id + "': " + e.getMessage(), e.path(), id, source);
            }
        }

        private Rule resolve(String path, RuleDeclaration declaration) {
            Rule rule = registry.getRule(declaration.name())
                    .orElseThrow(() -> new UnknownRuleException(
                            String.format(
                                    "Unknown rule '%s' on field '%s', registered rules are: %s",
                                    declaration.name(), path, registry.names()),
                            declaration.name(),
                            id,
                            source));

            ParameterCount count = rule.parameterCount();
            List<String> parameters = declaration.parameters();
            if (!count.accepts(parameters.size())) {
                throw new RuleParameterException(
                        String.format(
                                "Rule '%s' on field '%s' expects %s parameter(s), got %d: %s",
                                declaration.name(), path, count.describe(), parameters.size(), parameters),
                        declaration.name(),
                        id,
                        source);
            }
            try {
                rule.checkParameters(parameters);
            } catch (IllegalArgumentException e) {
                throw new RuleParameterException(
                        String.format(
                                "Rule '%s' on field '%s' has invalid parameters: %s",
                                declaration, path, e.getMessage()),
                        e,
                        declaration.name(),
                        id,
                        source);
            }
            return rule;
        }

        private void warnOnMissingPredecessor(
                String path, RuleDeclaration declaration, Rule rule, List<BoundRule> earlier) {
            Set<String> expected = rule.expectedPredecessors();
            if (expected.isEmpty()) {
                return;
            }
            for (BoundRule previous : earlier) {
                if (expected.contains(previous.name())) {
                    return;
                }
            }
            LOG.warn(
                    "Rule set '{}': '{}' on field '{}' is not preceded by any of {}, it only passes if the value"
                            + " was converted beforehand",
                    id,
                    declaration,
                    path,
                    expected);
        }
    }
}
