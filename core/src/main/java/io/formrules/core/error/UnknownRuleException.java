package io.formrules.core.error;

/** Thrown when a rule declaration names a rule that is not registered. */
public final class UnknownRuleException extends RuleSetException {

    private static final long serialVersionUID = 1L;

    private final String ruleName;

    public UnknownRuleException(String message, String ruleName, String ruleSetId, String source) {
        super(message, ruleSetId, source);
        this.ruleName = ruleName;
    }

    public String ruleName() {
        return ruleName;
    }
}
