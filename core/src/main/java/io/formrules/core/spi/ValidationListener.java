package io.formrules.core.spi;

/**
 * Observability hooks for the validation engine.
 *
 * <p>Adapters bridge these events to metrics or tracing systems; the core has no telemetry
 * dependency. Implementations MUST be thread-safe and non-blocking. Exceptions thrown by a
 * listener are caught by the engine and logged, they never affect validation.
 */
public interface ValidationListener {

    /**
     * Called when a rule set is loaded (or reloaded).
     *
     * @param event contains ruleSetId, fieldCount, source
     */
    void onRuleSetLoaded(RuleSetLoadedEvent event);

    /**
     * Called when a rule set is rejected at load time.
     *
     * @param event contains source, errorDetail
     */
    void onRuleSetRejected(RuleSetRejectedEvent event);

    /**
     * Called after every validation pass, valid or not.
     *
     * @param event contains ruleSetId, violationCount, durationMs
     */
    void onValidationCompleted(ValidationCompletedEvent event);

    // --- Event records ---

    /** Event emitted when a rule set is loaded. */
    record RuleSetLoadedEvent(String ruleSetId, int fieldCount, String source) {}

    /** Event emitted when a rule set fails to load. */
    record RuleSetRejectedEvent(String source, String errorDetail) {}

    /** Event emitted when a validation pass completes. */
    record ValidationCompletedEvent(String ruleSetId, int violationCount, long durationMs) {

        public boolean valid() {
            return violationCount == 0;
        }
    }
}
