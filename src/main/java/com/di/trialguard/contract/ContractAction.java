package com.di.trialguard.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What the caller should do with data evaluated against a contract.
 */
public enum ContractAction {

    /** Promote. */
    ACCEPT("accept"),
    /** Promote and notify: non-breaking drift or a tolerable share of failing records. */
    ALERT("alert"),
    /** Withhold pending review. */
    QUARANTINE("quarantine");

    private final String tag;

    ContractAction(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static ContractAction fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (ContractAction action : values()) {
                if (action.tag.equals(normalized)) {
                    return action;
                }
            }
        }
        throw new IllegalArgumentException("Unknown contract action: '" + tag + "'");
    }

    public boolean isValid() {
        return switch (this) {
            case ACCEPT, ALERT -> true;
            case QUARANTINE -> false;
        };
    }
}
