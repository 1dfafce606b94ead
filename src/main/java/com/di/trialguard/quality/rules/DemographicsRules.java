package com.di.trialguard.quality.rules;

import com.di.trialguard.quality.RuleChecks;
import com.di.trialguard.quality.RuleSet;
import com.di.trialguard.quality.RuleSetProvider;
import com.di.trialguard.quality.Severity;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Demographics (DM): one record per subject. Every other domain references it, so identity and
 * controlled-terminology rules are ERROR severity.
 */
@Component
public class DemographicsRules implements RuleSetProvider {

    public static final String DOMAIN = "DM";

    @Override
    public String domain() {
        return DOMAIN;
    }

    @Override
    public RuleSet ruleSet() {
        return RuleSet.builder(DOMAIN)
                .description("Demographics: subject master")
                .addRule("DM_001", "USUBJID must be unique - each subject appears only once",
                        RuleChecks.unique("USUBJID"))
                .addRule("DM_002", "USUBJID cannot be null",
                        RuleChecks.notNull("USUBJID"))
                .addRule("DM_003", "AGE must be between 0 and 120 years",
                        RuleChecks.between("AGE", 0, 120))
                .addRule("DM_004", "SEX must be M, F, U, or UNDIFFERENTIATED (CDISC CT)",
                        RuleChecks.inVocabulary("SEX", Set.of("M", "F", "U", "UNDIFFERENTIATED"), true))
                .addRule("DM_005", "ARM (treatment arm) should be populated",
                        RuleChecks.notNull("ARM"), Severity.WARNING)
                .addRule("DM_006", "RFSTDTC must be valid ISO 8601 date format (YYYY-MM-DD)",
                        RuleChecks.isoDate("RFSTDTC"))
                .build();
    }
}
