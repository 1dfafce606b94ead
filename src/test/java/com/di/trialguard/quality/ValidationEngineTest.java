package com.di.trialguard.quality;

import com.di.trialguard.dataset.Dataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ValidationEngine Tests")
class ValidationEngineTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);

    private static final RuleCheck ALWAYS_PASSES = ds -> RuleOutcome.ofFailures(ds.emptyCopy());
    private static final RuleCheck ALWAYS_FAILS = RuleOutcome::ofFailures;

    private static Dataset subjects() {
        return Dataset.builder("USUBJID", "AGE")
                .row("S1", 30)
                .row("S2", 150)
                .row("S3", null)
                .row("S4", -1)
                .build();
    }

    private static ValidationEngine engine(RuleSet.Builder builder) {
        return new ValidationEngine(builder.build(), 100, FIXED);
    }

    @Test
    @DisplayName("Should return one result per rule in registration order")
    void testResultsFollowRegistrationOrder() {
        ValidationEngine engine = engine(RuleSet.builder("DM")
                .addRule("Z_LAST_NAME", "", ALWAYS_PASSES)
                .addRule("A_FIRST_NAME", "", ALWAYS_PASSES)
                .addRule("M_MIDDLE", "", RuleChecks.between("AGE", 0, 120)));

        QualityReport report = engine.validate(subjects());

        assertEquals(List.of("Z_LAST_NAME", "A_FIRST_NAME", "M_MIDDLE"),
                report.results().stream().map(ValidationResult::ruleName).toList());
        assertEquals(4, report.totalRecords());
        assertEquals("DM", report.domain());
        assertEquals(Instant.parse("2024-03-01T12:00:00Z"), report.timestamp());
    }

    @Test
    @DisplayName("Should report failing records, percentage and ids for a range rule")
    void testRangeRuleFailures() {
        ValidationEngine engine = engine(RuleSet.builder("DM")
                .addRule("AGE_RANGE", "AGE between 0 and 120", RuleChecks.between("AGE", 0, 120)));

        ValidationResult result = engine.validate(subjects()).results().get(0);

        assertFalse(result.passed());
        assertEquals(4, result.recordsChecked());
        assertEquals(2, result.recordsFailed());
        assertEquals(50.0, result.failurePercentage());
        assertEquals(List.of("S2", "S4"), result.failedRecordIds());
        assertEquals(Severity.ERROR, result.severity());
    }

    @Test
    @DisplayName("Should round failure percentage to two decimals")
    void testFailurePercentageRounding() {
        assertEquals(33.33, ValidationResult.failurePercentage(1, 3));
        assertEquals(66.67, ValidationResult.failurePercentage(2, 3));
        assertEquals(0.0, ValidationResult.failurePercentage(0, 0));
    }

    @Test
    @DisplayName("Should report zero failure percentage on an empty dataset")
    void testEmptyDataset() {
        ValidationEngine engine = engine(RuleSet.builder("DM")
                .addRule("FAILS", "", ALWAYS_FAILS)
                .addRule("BROKEN", "", ds -> {
                    throw new IllegalStateException("boom");
                }));

        QualityReport report = engine.validate(subjects().emptyCopy());

        for (ValidationResult result : report.results()) {
            assertEquals(0, result.recordsChecked());
            assertEquals(0.0, result.failurePercentage());
        }
    }

    @Test
    @DisplayName("Should contain a throwing rule as a failed ERROR result and keep running")
    void testThrowingRuleIsContained() {
        ValidationEngine engine = engine(RuleSet.builder("DM")
                .addRule("BROKEN", "references a missing column", RuleChecks.notNull("MISSING"), Severity.INFO)
                .addRule("AFTER", "", ALWAYS_PASSES));

        QualityReport report = engine.validate(subjects());

        ValidationResult broken = report.results().get(0);
        assertFalse(broken.passed());
        assertEquals(Severity.ERROR, broken.severity());
        assertEquals(4, broken.recordsFailed());
        assertEquals(100.0, broken.failurePercentage());
        assertTrue(broken.details().get("error").contains("MISSING"));
        assertTrue(report.results().get(1).passed());
        assertEquals(ValidationStatus.FAILED, report.status());
    }

    @Test
    @DisplayName("Should contain a rule that overflows the stack and propagate other errors")
    void testThrowingRule_Errors() {
        ValidationEngine overflowing = engine(RuleSet.builder("DM")
                .addRule("RECURSIVE", "", dataset -> {
                    throw new StackOverflowError();
                }, Severity.WARNING)
                .addRule("AFTER", "", ALWAYS_PASSES));

        QualityReport report = overflowing.validate(subjects());

        ValidationResult recursive = report.results().get(0);
        assertFalse(recursive.passed());
        assertEquals(Severity.ERROR, recursive.severity());
        assertEquals("StackOverflowError", recursive.details().get("error"));
        assertEquals(StackOverflowError.class.getName(), recursive.details().get("error_type"));
        assertTrue(report.results().get(1).passed());

        ValidationEngine exhausted = engine(RuleSet.builder("DM")
                .addRule("HUNGRY", "", dataset -> {
                    throw new OutOfMemoryError("heap");
                }, Severity.WARNING));
        assertThrows(OutOfMemoryError.class, () -> exhausted.validate(subjects()));
    }

    @Test
    @DisplayName("Should derive FAILED only from failed ERROR results")
    void testStatusDerivation() {
        assertEquals(ValidationStatus.PASSED, engine(RuleSet.builder("X")
                .addRule("OK", "", ALWAYS_PASSES)).validate(subjects()).status());

        assertEquals(ValidationStatus.PASSED_WITH_WARNINGS, engine(RuleSet.builder("X")
                .addRule("OK", "", ALWAYS_PASSES)
                .addRule("WARN", "", ALWAYS_FAILS, Severity.WARNING)).validate(subjects()).status());

        assertEquals(ValidationStatus.PASSED, engine(RuleSet.builder("X")
                .addRule("NOTE", "", ALWAYS_FAILS, Severity.INFO)).validate(subjects()).status());

        assertEquals(ValidationStatus.FAILED, engine(RuleSet.builder("X")
                .addRule("WARN", "", ALWAYS_FAILS, Severity.WARNING)
                .addRule("ERR", "", ALWAYS_FAILS)).validate(subjects()).status());
    }

    @Test
    @DisplayName("Should reject a rule name registered twice")
    void testDuplicateRule() {
        RuleSet.Builder builder = RuleSet.builder("DM").addRule("DM_001", "", ALWAYS_PASSES);
        DuplicateRuleException e = assertThrows(DuplicateRuleException.class,
                () -> builder.addRule("DM_001", "again", ALWAYS_FAILS));
        assertTrue(e.getMessage().contains("DM_001"));
    }

    @Test
    @DisplayName("Should cap failed record ids at the configured maximum")
    void testFailedRecordIdsCap() {
        ValidationEngine engine = new ValidationEngine(
                RuleSet.builder("DM").addRule("FAILS", "", ALWAYS_FAILS).build(), 2, FIXED);

        ValidationResult result = engine.validate(subjects()).results().get(0);

        assertEquals(4, result.recordsFailed());
        assertEquals(List.of("S1", "S2"), result.failedRecordIds());
    }

    @Test
    @DisplayName("Should leave failed ids empty when the id column is absent")
    void testMissingIdColumn() {
        ValidationEngine engine = engine(RuleSet.builder("DM").addRule("FAILS", "", ALWAYS_FAILS));
        QualityReport report = engine.validate(subjects(), "SUBJID", "s3://bucket/dm.parquet", Map.of("run", "7"));

        assertTrue(report.results().get(0).failedRecordIds().isEmpty());
        assertEquals("s3://bucket/dm.parquet", report.source());
        assertEquals("7", report.metadata().get("run"));
    }

    @Test
    @DisplayName("Should summarise checks by outcome and severity")
    void testSummary() {
        QualityReport report = engine(RuleSet.builder("X")
                .addRule("OK", "", ALWAYS_PASSES)
                .addRule("WARN", "", ALWAYS_FAILS, Severity.WARNING)
                .addRule("ERR", "", ALWAYS_FAILS)).validate(subjects());

        Map<String, Long> summary = report.summary();
        assertEquals(3L, summary.get("total_checks"));
        assertEquals(1L, summary.get("passed"));
        assertEquals(2L, summary.get("failed"));
        assertEquals(1L, summary.get("errors"));
        assertEquals(1L, summary.get("warnings"));
    }

    @Test
    @DisplayName("Should never mutate the input dataset")
    void testDatasetUntouched() {
        Dataset dataset = subjects();
        engine(RuleSet.builder("DM").addRule("AGE", "", RuleChecks.between("AGE", 0, 120))).validate(dataset);
        assertEquals(4, dataset.size());
        assertEquals(150, dataset.row(1).get("AGE"));
    }
}
