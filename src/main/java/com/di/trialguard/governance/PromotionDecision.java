package com.di.trialguard.governance;

import com.di.trialguard.contract.ContractAction;
import com.di.trialguard.quality.ValidationStatus;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of the promotion gate for one dataset.
 */
public enum PromotionDecision {
    PROMOTE,
    PROMOTE_WITH_ALERT,
    QUARANTINE;

    @JsonValue
    public String getTag() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PromotionDecision fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Promotion decision cannot be null or blank");
        }
        return valueOf(tag.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Combines the two verdicts; either may be {@code null} when that check was skipped.
     * The stricter of the two wins.
     */
    public static PromotionDecision derive(ValidationStatus quality, ContractAction contract) {
        PromotionDecision fromQuality = quality == null ? PROMOTE : switch (quality) {
            case PASSED -> PROMOTE;
            case PASSED_WITH_WARNINGS -> PROMOTE_WITH_ALERT;
            case FAILED -> QUARANTINE;
        };
        PromotionDecision fromContract = contract == null ? PROMOTE : switch (contract) {
            case ACCEPT -> PROMOTE;
            case ALERT -> PROMOTE_WITH_ALERT;
            case QUARANTINE -> QUARANTINE;
        };
        return fromQuality.ordinal() >= fromContract.ordinal() ? fromQuality : fromContract;
    }

    public boolean isPromoted() {
        return switch (this) {
            case PROMOTE, PROMOTE_WITH_ALERT -> true;
            case QUARANTINE -> false;
        };
    }
}
