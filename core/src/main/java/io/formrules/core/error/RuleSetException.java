package io.formrules.core.error;

/**
 * Abstract base for all formrules configuration exceptions. Never thrown directly, use one of the
 * concrete subclasses.
 *
 * <p>These are programmer or operator errors detected while rule sets are being built or loaded.
 * Validation failures of submitted data are never reported through this hierarchy; they are
 * returned as {@link io.formrules.core.model.ValidationResult} data.
 */
public abstract class RuleSetException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String ruleSetId;
    private final String source;

    protected RuleSetException(String message, String ruleSetId, String source) {
        super(message);
        this.ruleSetId = ruleSetId;
        this.source = source;
    }

    protected RuleSetException(String message, Throwable cause, String ruleSetId, String source) {
        super(message, cause);
        this.ruleSetId = ruleSetId;
        this.source = source;
    }

    /** The rule set that triggered the error, or {@code null} if not yet identified. */
    public String ruleSetId() {
        return ruleSetId;
    }

    /** The file path or resource identifier that caused the error, or {@code null}. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
