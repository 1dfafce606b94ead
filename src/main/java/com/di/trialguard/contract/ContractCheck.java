package com.di.trialguard.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Value-level contract clauses, declared in evaluation order.
 */
public enum ContractCheck {

    NOT_NULL("not_null"),
    UNIQUE("unique"),
    ALLOWED_VALUES("allowed_values"),
    MIN_VALUE("min_value"),
    MAX_VALUE("max_value");

    private final String tag;

    ContractCheck(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static ContractCheck fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (ContractCheck check : values()) {
                if (check.tag.equals(normalized)) {
                    return check;
                }
            }
        }
        throw new IllegalArgumentException("Unknown contract check: '" + tag + "'");
    }
}
