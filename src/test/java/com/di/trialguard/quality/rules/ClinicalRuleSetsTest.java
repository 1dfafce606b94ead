package com.di.trialguard.quality.rules;

import com.di.trialguard.dataset.Dataset;
import com.di.trialguard.quality.QualityReport;
import com.di.trialguard.quality.RuleSet;
import com.di.trialguard.quality.Severity;
import com.di.trialguard.quality.ValidationEngine;
import com.di.trialguard.quality.ValidationResult;
import com.di.trialguard.quality.ValidationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Clinical rule set Tests")
class ClinicalRuleSetsTest {

    private static ValidationResult result(QualityReport report, String ruleName) {
        return report.results().stream()
                .filter(r -> r.ruleName().equals(ruleName))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No result for " + ruleName));
    }

    private static QualityReport validate(RuleSet ruleSet, Dataset dataset) {
        return new ValidationEngine(ruleSet).validate(dataset);
    }

    @Nested
    @DisplayName("Demographics")
    class Demographics {

        private final RuleSet ruleSet = new DemographicsRules().ruleSet();

        @Test
        @DisplayName("Should register DM_001 to DM_006 in order")
        void testRuleNames() {
            assertEquals("DM", ruleSet.getDomain());
            assertEquals(List.of("DM_001", "DM_002", "DM_003", "DM_004", "DM_005", "DM_006"), ruleSet.getRuleNames());
            assertEquals(Severity.WARNING, ruleSet.getRules().get(4).severity());
        }

        @Test
        @DisplayName("Should pass a clean subject master")
        void testCleanData() {
            Dataset dm = Dataset.builder("USUBJID", "AGE", "SEX", "ARM", "RFSTDTC")
                    .row("S1", 34, "M", "PLACEBO", "2024-01-15")
                    .row("S2", 51, "f", "DRUG", "2024-02-01T09:30:00")
                    .row("S3", 70, "undifferentiated", "DRUG", "2024-02-03")
                    .build();

            QualityReport report = validate(ruleSet, dm);

            assertEquals(ValidationStatus.PASSED, report.status());
            assertTrue(report.results().stream().allMatch(ValidationResult::passed));
        }

        @Test
        @DisplayName("Should flag duplicates, bad ages, vocabulary and dates")
        void testDirtyData() {
            Dataset dm = Dataset.builder("USUBJID", "AGE", "SEX", "ARM", "RFSTDTC")
                    .row("S1", 34, "M", "PLACEBO", "2024-01-15")
                    .row("S1", 121, "X", null, "15/01/2024")
                    .row(null, 40, null, "DRUG", null)
                    .row("S4", 20, "F", "DRUG", "2024-02-30")
                    .build();

            QualityReport report = validate(ruleSet, dm);

            assertEquals(ValidationStatus.FAILED, report.status());
            assertEquals(2, result(report, "DM_001").recordsFailed());
            assertEquals(1, result(report, "DM_002").recordsFailed());
            assertEquals(1, result(report, "DM_003").recordsFailed());
            assertEquals(2, result(report, "DM_004").recordsFailed());
            assertEquals(1, result(report, "DM_005").recordsFailed());
            assertEquals(3, result(report, "DM_006").recordsFailed());
        }

        @Test
        @DisplayName("Should only warn when ARM is missing")
        void testMissingArmIsWarning() {
            Dataset dm = Dataset.builder("USUBJID", "AGE", "SEX", "ARM", "RFSTDTC")
                    .row("S1", 34, "M", null, "2024-01-15")
                    .build();
            assertEquals(ValidationStatus.PASSED_WITH_WARNINGS, validate(ruleSet, dm).status());
        }
    }

    @Nested
    @DisplayName("Adverse events")
    class AdverseEvents {

        private final RuleSet ruleSet = new AdverseEventRules().ruleSet();

        @Test
        @DisplayName("Should exclude rows missing either date from the date ordering rule")
        void testDateOrdering() {
            Dataset ae = Dataset.builder("USUBJID", "AETERM", "AESEV", "AESER", "AESTDTC", "AEENDTC")
                    .row("S1", "HEADACHE", "mild", "N", "2024-01-10", "2024-01-12")
                    .row("S1", "NAUSEA", "MODERATE", "N", "2024-01-10", "2024-01-05")
                    .row("S2", "RASH", "SEVERE", "Y", "2024-01-10", null)
                    .row("S3", "FEVER", "MILD", "N", null, "2024-01-01")
                    .build();

            QualityReport report = validate(ruleSet, ae);

            ValidationResult ordering = result(report, "AE_005");
            assertEquals(1, ordering.recordsFailed());
            assertEquals(List.of("S1"), ordering.failedRecordIds());
            assertTrue(result(report, "AE_003").passed());
            assertEquals(ValidationStatus.FAILED, report.status());
        }

        @Test
        @DisplayName("Should treat a null severity as outside the vocabulary")
        void testNullSeverity() {
            Dataset ae = Dataset.builder("USUBJID", "AETERM", "AESEV", "AESER", "AESTDTC", "AEENDTC")
                    .row("S1", "HEADACHE", null, "Maybe", "2024-01-10", "2024-01-12")
                    .build();

            QualityReport report = validate(ruleSet, ae);

            assertFalse(result(report, "AE_003").passed());
            assertFalse(result(report, "AE_004").passed());
        }
    }

    @Nested
    @DisplayName("Vital signs")
    class VitalSigns {

        private final RuleSet ruleSet = new VitalSignsRules().ruleSet();

        @Test
        @DisplayName("Should warn on negative and implausible values")
        void testRanges() {
            Dataset vs = Dataset.builder("USUBJID", "VSTESTCD", "VSSTRESN")
                    .row("S1", "HR", 72.0)
                    .row("S1", "HR", 300.0)
                    .row("S1", "TEMP", 29.5)
                    .row("S1", "WEIGHT", -3.0)
                    .row("S1", "SYSBP", null)
                    .build();

            QualityReport report = validate(ruleSet, vs);

            assertEquals(1, result(report, "VS_003").recordsFailed());
            assertEquals(2, result(report, "VS_004").recordsFailed());
            assertEquals(ValidationStatus.PASSED_WITH_WARNINGS, report.status());
        }

        @Test
        @DisplayName("Should cover heart rate, systolic pressure and temperature")
        void testPhysiologicalRanges() {
            assertTrue(VitalSignsRules.PHYSIOLOGICAL_RANGES.get("HR").contains(20));
            assertFalse(VitalSignsRules.PHYSIOLOGICAL_RANGES.get("SYSBP").contains(251));
            assertTrue(VitalSignsRules.PHYSIOLOGICAL_RANGES.get("TEMP").contains(45));
        }
    }

    @Nested
    @DisplayName("Lab results")
    class LabResults {

        private final RuleSet ruleSet = new LabResultsRules().ruleSet();

        @Test
        @DisplayName("Should fail inverted reference ranges and warn on unknown indicators")
        void testReferenceRanges() {
            Dataset lb = Dataset.builder("USUBJID", "LBTESTCD", "LBNRIND", "LBORNRLO", "LBORNRHI")
                    .row("S1", "ALT", "NORMAL", 7.0, 56.0)
                    .row("S1", "AST", "BORDERLINE", 40.0, 10.0)
                    .row("S2", "GLUC", null, 70.0, 70.0)
                    .row("S3", "HGB", "low", null, 17.5)
                    .build();

            QualityReport report = validate(ruleSet, lb);

            assertEquals(1, result(report, "LB_003").recordsFailed());
            assertEquals(Severity.WARNING, result(report, "LB_003").severity());
            assertEquals(2, result(report, "LB_004").recordsFailed());
            assertEquals(ValidationStatus.FAILED, report.status());
        }
    }
}
