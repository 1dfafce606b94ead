package com.di.trialguard.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Schema evolution policy of a contract.
 */
public enum CompatibilityMode {

    /** New schema can read old data: removed columns break. */
    BACKWARD("backward"),
    /** Old schema can read new data: added columns break. */
    FORWARD("forward"),
    /** Both directions: removed columns break. */
    FULL("full"),
    NONE("none");

    private final String tag;

    CompatibilityMode(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static CompatibilityMode fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Compatibility mode cannot be null or blank");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (CompatibilityMode mode : values()) {
            if (mode.tag.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown compatibility mode: '" + tag + "'");
    }

    /** Whether a column present in incoming data but not declared breaks the contract. */
    public boolean addedColumnBreaks() {
        return switch (this) {
            case FORWARD -> true;
            case BACKWARD, FULL, NONE -> false;
        };
    }

    /** Whether a declared column missing from incoming data breaks the contract. */
    public boolean removedColumnBreaks() {
        return switch (this) {
            case BACKWARD, FULL -> true;
            case FORWARD, NONE -> false;
        };
    }
}
