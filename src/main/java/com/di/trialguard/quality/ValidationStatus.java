package com.di.trialguard.quality;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Locale;

/**
 * Aggregate verdict of a quality run.
 */
public enum ValidationStatus {
    PASSED,
    FAILED,
    PASSED_WITH_WARNINGS;

    @JsonValue
    public String getTag() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ValidationStatus fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Validation status cannot be null or blank");
        }
        return valueOf(tag.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * FAILED if any failed ERROR result exists, else PASSED_WITH_WARNINGS if any failed WARNING result
     * exists, else PASSED. Failed INFO results never change the verdict.
     */
    public static ValidationStatus derive(Collection<ValidationResult> results) {
        ValidationStatus status = PASSED;
        for (ValidationResult result : results) {
            if (result.passed()) {
                continue;
            }
            ValidationStatus implied = switch (result.severity()) {
                case ERROR -> FAILED;
                case WARNING -> PASSED_WITH_WARNINGS;
                case INFO -> PASSED;
            };
            if (implied.rank() > status.rank()) {
                status = implied;
            }
        }
        return status;
    }

    private int rank() {
        return switch (this) {
            case PASSED -> 0;
            case PASSED_WITH_WARNINGS -> 1;
            case FAILED -> 2;
        };
    }
}
