package com.di.trialguard.quality;

import java.util.Objects;

/**
 * A named, severity-tagged check over a dataset.
 */
public record Rule(String name, String description, Severity severity, RuleCheck check) {

    public Rule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rule name cannot be null or blank");
        }
        Objects.requireNonNull(check, "check");
        description = description != null ? description : "";
        severity = severity != null ? severity : Severity.ERROR;
    }
}
