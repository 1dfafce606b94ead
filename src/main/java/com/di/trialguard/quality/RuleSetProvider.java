package com.di.trialguard.quality;

/**
 * Supplies the pre-built rule set of one domain. Implementations are Spring components discovered by
 * {@link RuleSetRegistry}.
 */
public interface RuleSetProvider {

    /** Domain key, e.g. {@code DM}. Matched case-insensitively. */
    String domain();

    /** The immutable rule set; called once at registry start-up. */
    RuleSet ruleSet();
}
