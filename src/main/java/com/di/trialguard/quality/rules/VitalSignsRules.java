package com.di.trialguard.quality.rules;

import com.di.trialguard.quality.RuleChecks;
import com.di.trialguard.quality.RuleChecks.Range;
import com.di.trialguard.quality.RuleSet;
import com.di.trialguard.quality.RuleSetProvider;
import com.di.trialguard.quality.Severity;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Vital signs (VS): numeric observations. Implausible values are flagged, not rejected.
 */
@Component
public class VitalSignsRules implements RuleSetProvider {

    public static final String DOMAIN = "VS";

    /** Physiological plausibility by test code. */
    static final Map<String, Range> PHYSIOLOGICAL_RANGES = Map.of(
            "HR", new Range(20, 250),
            "SYSBP", new Range(50, 250),
            "TEMP", new Range(30, 45)
    );

    @Override
    public String domain() {
        return DOMAIN;
    }

    @Override
    public RuleSet ruleSet() {
        return RuleSet.builder(DOMAIN)
                .description("Vital signs: numeric observations")
                .addRule("VS_001", "USUBJID cannot be null",
                        RuleChecks.notNull("USUBJID"))
                .addRule("VS_002", "VSTESTCD (test code) cannot be null",
                        RuleChecks.notNull("VSTESTCD"))
                .addRule("VS_003", "VSSTRESN (numeric result) should be positive",
                        RuleChecks.nonNegative("VSSTRESN"), Severity.WARNING)
                .addRule("VS_004", "Vital sign values must be within physiological range",
                        RuleChecks.rangeByCode("VSTESTCD", "VSSTRESN", PHYSIOLOGICAL_RANGES), Severity.WARNING)
                .build();
    }
}
