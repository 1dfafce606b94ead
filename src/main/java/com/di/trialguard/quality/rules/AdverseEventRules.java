package com.di.trialguard.quality.rules;

import com.di.trialguard.quality.RuleChecks;
import com.di.trialguard.quality.RuleSet;
import com.di.trialguard.quality.RuleSetProvider;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Adverse events (AE): event log feeding safety reporting.
 */
@Component
public class AdverseEventRules implements RuleSetProvider {

    public static final String DOMAIN = "AE";

    @Override
    public String domain() {
        return DOMAIN;
    }

    @Override
    public RuleSet ruleSet() {
        return RuleSet.builder(DOMAIN)
                .description("Adverse events: event log")
                .addRule("AE_001", "USUBJID cannot be null",
                        RuleChecks.notNull("USUBJID"))
                .addRule("AE_002", "AETERM (adverse event term) cannot be null",
                        RuleChecks.notNull("AETERM"))
                .addRule("AE_003", "AESEV must be MILD, MODERATE, or SEVERE",
                        RuleChecks.inVocabulary("AESEV", Set.of("MILD", "MODERATE", "SEVERE"), true))
                .addRule("AE_004", "AESER (serious flag) must be Y or N",
                        RuleChecks.inVocabulary("AESER", Set.of("Y", "N"), true))
                // rows without both dates are not evaluated by AE_005
                .addRule("AE_005", "AEENDTC (end date) must be >= AESTDTC (start date)",
                        RuleChecks.notBefore("AESTDTC", "AEENDTC"))
                .build();
    }
}
