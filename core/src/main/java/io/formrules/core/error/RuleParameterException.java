package io.formrules.core.error;

/**
 * Thrown when a rule declaration carries parameters the rule cannot accept: wrong parameter
 * count, an unparsable date layout, a non-numeric bound, or a reference to a field the rule set
 * does not declare.
 */
public final class RuleParameterException extends RuleSetException {

    private static final long serialVersionUID = 1L;

    private final String ruleName;

    public RuleParameterException(String message, String ruleName, String ruleSetId, String source) {
        super(message, ruleSetId, source);
        this.ruleName = ruleName;
    }

    public RuleParameterException(String message, Throwable cause, String ruleName, String ruleSetId, String source) {
        super(message, cause, ruleSetId, source);
        this.ruleName = ruleName;
    }

    /** Name of the rule whose declaration was rejected. */
    public String ruleName() {
        return ruleName;
    }
}
