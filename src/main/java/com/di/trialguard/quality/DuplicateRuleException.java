package com.di.trialguard.quality;

/**
 * Thrown when a rule name is registered twice in the same {@link RuleSet}.
 */
public class DuplicateRuleException extends IllegalArgumentException {

    public DuplicateRuleException(String ruleSet, String ruleName) {
        super(String.format("Rule '%s' is already registered in rule set '%s'", ruleName, ruleSet));
    }
}
