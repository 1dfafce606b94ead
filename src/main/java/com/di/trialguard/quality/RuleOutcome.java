package com.di.trialguard.quality;

import com.di.trialguard.dataset.Dataset;

import java.util.Objects;

/**
 * What a rule check returns: the pass flag and the rows that violated the rule.
 */
public record RuleOutcome(boolean passed, Dataset failingRows) {

    public RuleOutcome {
        Objects.requireNonNull(failingRows, "failingRows");
    }

    /** Passed exactly when no row failed. */
    public static RuleOutcome ofFailures(Dataset failingRows) {
        return new RuleOutcome(failingRows.isEmpty(), failingRows);
    }
}
