package com.di.trialguard.quality;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How serious a failed rule is.
 * <ul>
 *   <li>{@link #ERROR}: the dataset cannot advance</li>
 *   <li>{@link #WARNING}: the dataset advances but is flagged for review</li>
 *   <li>{@link #INFO}: recorded for monitoring only</li>
 * </ul>
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO;

    @JsonValue
    public String getTag() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Severity cannot be null or blank");
        }
        return valueOf(tag.trim().toUpperCase(Locale.ROOT));
    }
}
