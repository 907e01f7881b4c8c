package io.formrules.core.engine;

import io.formrules.core.model.RuleSet;
import io.formrules.core.model.ValidationResult;
import io.formrules.core.spec.RuleSetParser;
import io.formrules.core.spi.ValidationListener;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the validation core: loads rule sets and validates forms against them.
 *
 * <p>Rule sets are loaded at startup; every configuration error surfaces from
 * {@link #loadRuleSet}, {@link #register} or {@link #reload} so that a broken rule set stops the
 * application before it serves requests. Validation itself never throws for bad input: failing
 * rules are returned in the {@link ValidationResult}.
 *
 * <p>Thread-safe: uses an {@link AtomicReference} to hold an immutable {@link RuleSetRegistry}
 * snapshot. {@link #reload} swaps the entire registry so in-flight validations complete with the
 * old snapshot while new ones pick up the new one.
 */
public final class ValidationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationEngine.class);

    private final RuleSetParser parser;
    private final Validator validator;
    private final FormReader formReader;
    private final ValidationListener listener;
    private final AtomicReference<RuleSetRegistry> registryRef = new AtomicReference<>(RuleSetRegistry.empty());

    /**
     * Creates an engine without listener.
     *
     * @param parser the parser used to load rule-set YAML files
     */
    public ValidationEngine(RuleSetParser parser) {
        this(parser, new Validator(), new FormReader(), null);
    }

    /**
     * Creates an engine with all collaborators.
     *
     * @param parser     the parser used to load rule-set YAML files
     * @param validator  evaluates rule sets against forms
     * @param formReader decodes JSON bodies
     * @param listener   optional listener for lifecycle events, may be null
     */
    public ValidationEngine(
            RuleSetParser parser, Validator validator, FormReader formReader, ValidationListener listener) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.formReader = Objects.requireNonNull(formReader, "formReader must not be null");
        this.listener = listener; // nullable
    }

    /**
     * Loads a rule set from a YAML file and registers it by id. A rule set with the same id is
     * replaced.
     *
     * @param path path to the rule-set YAML file
     * @return the loaded rule set
     * @throws io.formrules.core.error.RuleSetException if the file is invalid
     */
    public RuleSet loadRuleSet(Path path) {
        try {
            RuleSet ruleSet = parser.parse(path);
            registryRef.updateAndGet(old -> old.toBuilder().add(ruleSet).build());
            LOG.info("Rule set loaded: id={}, fields={}, source={}", ruleSet.id(), ruleSet.fields().size(), path);
            notifyRuleSetLoaded(ruleSet, path.toString());
            return ruleSet;
        } catch (RuntimeException e) {
            notifyRuleSetRejected(path.toString(), e);
            throw e;
        }
    }

    /**
     * Registers a rule set built in code.
     *
     * @param ruleSet the rule set, replacing any rule set with the same id
     */
    public void register(RuleSet ruleSet) {
        Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        registryRef.updateAndGet(old -> old.toBuilder().add(ruleSet).build());
        LOG.info("Rule set registered: id={}, fields={}", ruleSet.id(), ruleSet.fields().size());
        notifyRuleSetLoaded(ruleSet, ruleSet.source());
    }

    /**
     * Replaces every loaded rule set by the rule sets of the given files. The swap is atomic: if
     * any file fails to load, the current registry stays in place and the error is thrown.
     *
     * @param paths rule-set YAML files
     * @throws io.formrules.core.error.RuleSetException if any file is invalid
     */
    public void reload(List<Path> paths) {
        RuleSetRegistry.Builder builder = RuleSetRegistry.builder();
        for (Path path : paths) {
            RuleSet ruleSet;
            try {
                ruleSet = parser.parse(path);
            } catch (RuntimeException e) {
                notifyRuleSetRejected(path.toString(), e);
                LOG.warn("Reload aborted, keeping {} loaded rule set(s): {}", registryRef.get().size(), e.getMessage());
                throw e;
            }
            builder.add(ruleSet);
            notifyRuleSetLoaded(ruleSet, path.toString());
        }
        RuleSetRegistry newRegistry = builder.build();
        registryRef.set(newRegistry);
        LOG.info("Registry reloaded: ruleSets={}", newRegistry.ids());
    }

    /**
     * Returns the current registry snapshot.
     *
     * @return the current immutable registry
     */
    public RuleSetRegistry registry() {
        return registryRef.get();
    }

    /**
     * Validates a form against a loaded rule set. The form is coerced in place.
     *
     * @param ruleSetId id of a loaded rule set
     * @param form      the submitted data
     * @return the validation outcome
     * @throws io.formrules.core.error.UnknownRuleSetException if no rule set has that id
     */
    public ValidationResult validate(String ruleSetId, Map<String, Object> form) {
        RuleSet ruleSet = registryRef.get().requireRuleSet(ruleSetId);
        long start = System.nanoTime();
        ValidationResult result = validator.validate(ruleSet, form);
        long durationMs = (System.nanoTime() - start) / 1_000_000;

        if (result.isValid()) {
            LOG.debug("Validation passed: ruleSet={}, durationMs={}", ruleSetId, durationMs);
        } else {
            LOG.debug(
                    "Validation failed: ruleSet={}, violations={}, durationMs={}",
                    ruleSetId,
                    result.violations().size(),
                    durationMs);
        }
        notifyValidationCompleted(result, durationMs);
        return result;
    }

    /**
     * Decodes a JSON object and validates it against a loaded rule set.
     *
     * @throws io.formrules.core.error.FormReadException if the body is not a JSON object
     */
    public ValidationResult validateJson(String ruleSetId, String json) {
        return validate(ruleSetId, formReader.read(json));
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged, they never affect validation.

    private void notifyRuleSetLoaded(RuleSet ruleSet, String source) {
        if (listener == null) return;
        try {
            listener.onRuleSetLoaded(new ValidationListener.RuleSetLoadedEvent(
                    ruleSet.id(), ruleSet.fields().size(), source));
        } catch (Exception e) {
            LOG.warn("ValidationListener.onRuleSetLoaded failed", e);
        }
    }

    private void notifyRuleSetRejected(String source, Exception cause) {
        if (listener == null) return;
        try {
            listener.onRuleSetRejected(new ValidationListener.RuleSetRejectedEvent(source, cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("ValidationListener.onRuleSetRejected failed", e);
        }
    }

    private void notifyValidationCompleted(ValidationResult result, long durationMs) {
        if (listener == null) return;
        try {
            listener.onValidationCompleted(new ValidationListener.ValidationCompletedEvent(
                    result.ruleSetId(), result.violations().size(), durationMs));
        } catch (Exception e) {
            LOG.warn("ValidationListener.onValidationCompleted failed", e);
        }
    }
}
