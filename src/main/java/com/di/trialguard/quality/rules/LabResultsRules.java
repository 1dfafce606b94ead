package com.di.trialguard.quality.rules;

import com.di.trialguard.quality.RuleChecks;
import com.di.trialguard.quality.RuleSet;
import com.di.trialguard.quality.RuleSetProvider;
import com.di.trialguard.quality.Severity;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Laboratory results (LB).
 */
@Component
public class LabResultsRules implements RuleSetProvider {

    public static final String DOMAIN = "LB";

    @Override
    public String domain() {
        return DOMAIN;
    }

    @Override
    public RuleSet ruleSet() {
        return RuleSet.builder(DOMAIN)
                .description("Laboratory results: numeric observations with reference ranges")
                .addRule("LB_001", "USUBJID cannot be null",
                        RuleChecks.notNull("USUBJID"))
                .addRule("LB_002", "LBTESTCD (test code) cannot be null",
                        RuleChecks.notNull("LBTESTCD"))
                .addRule("LB_003", "LBNRIND must be LOW, NORMAL, HIGH, or ABNORMAL",
                        RuleChecks.inVocabulary("LBNRIND", Set.of("LOW", "NORMAL", "HIGH", "ABNORMAL"), false),
                        Severity.WARNING)
                .addRule("LB_004", "LBORNRLO must be less than LBORNRHI",
                        RuleChecks.strictlyLess("LBORNRLO", "LBORNRHI"))
                .build();
    }
}
