package io.formrules.core.error;

/** Thrown when a rule-set YAML file has invalid syntax, unknown keys or missing required fields. */
public final class RuleSetParseException extends RuleSetException {

    private static final long serialVersionUID = 1L;

    public RuleSetParseException(String message, String ruleSetId, String source) {
        super(message, ruleSetId, source);
    }

    public RuleSetParseException(String message, Throwable cause, String ruleSetId, String source) {
        super(message, cause, ruleSetId, source);
    }
}
