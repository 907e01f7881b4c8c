package io.formrules.core.error;

/** Thrown when validation is requested against a rule-set id that has not been loaded. */
public final class UnknownRuleSetException extends RuleSetException {

    private static final long serialVersionUID = 1L;

    public UnknownRuleSetException(String message, String ruleSetId) {
        super(message, ruleSetId, null);
    }
}
