package com.di.trialguard.lineage;

/**
 * A {@link LineageTracker} was mutated or built again after its event was built.
 */
public class LineageTrackerStateException extends IllegalStateException {

    public LineageTrackerStateException(String message) {
        super(message);
    }
}
