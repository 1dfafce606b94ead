package com.di.trialguard.quality;

import com.di.trialguard.dataset.Dataset;

/**
 * Predicate half of a {@link Rule}. Implementations must not mutate the dataset. A {@link RuntimeException}
 * or {@link StackOverflowError} thrown here is recorded as a failed ERROR result and the remaining rules
 * still run; any other {@link Error} aborts the whole validation.
 */
@FunctionalInterface
public interface RuleCheck {

    RuleOutcome evaluate(Dataset dataset);
}
