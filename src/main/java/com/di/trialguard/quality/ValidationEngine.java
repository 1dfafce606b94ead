package com.di.trialguard.quality;

import com.di.trialguard.dataset.Dataset;
import com.di.trialguard.dataset.Values;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs every rule of a {@link RuleSet}, in registration order, against a fully materialised dataset and
 * aggregates the results into a {@link QualityReport}.
 *
 * <p>A rule that throws never aborts the run: it is recorded as a failed ERROR result covering every record,
 * with the error message under {@code details.error}. The engine holds no per-run state, so one instance can
 * validate independent datasets from several threads.
 */
@Slf4j
public class ValidationEngine {

    public static final String DEFAULT_ID_COLUMN = "USUBJID";
    public static final int DEFAULT_MAX_FAILED_RECORD_IDS = 100;

    private final RuleSet ruleSet;
    private final int maxFailedRecordIds;
    private final Clock clock;

    public ValidationEngine(RuleSet ruleSet) {
        this(ruleSet, DEFAULT_MAX_FAILED_RECORD_IDS, Clock.systemUTC());
    }

    public ValidationEngine(RuleSet ruleSet, int maxFailedRecordIds, Clock clock) {
        this.ruleSet = Objects.requireNonNull(ruleSet, "ruleSet");
        if (maxFailedRecordIds < 0) {
            throw new IllegalArgumentException("maxFailedRecordIds must be >= 0, got " + maxFailedRecordIds);
        }
        this.maxFailedRecordIds = maxFailedRecordIds;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RuleSet getRuleSet() {
        return ruleSet;
    }

    public QualityReport validate(Dataset dataset) {
        return validate(dataset, DEFAULT_ID_COLUMN);
    }

    public QualityReport validate(Dataset dataset, String idColumn) {
        return validate(dataset, idColumn, "", Map.of());
    }

    /**
     * @param dataset  dataset to check; never mutated
     * @param idColumn column whose values identify failing records in the report
     * @param source   identifier of where the dataset came from (path, table); recorded as-is
     * @param metadata free-form context copied into the report
     */
    public QualityReport validate(Dataset dataset, String idColumn, String source, Map<String, String> metadata) {
        Objects.requireNonNull(dataset, "dataset");
        long totalRecords = dataset.size();
        List<ValidationResult> results = new ArrayList<>(ruleSet.size());

        for (Rule rule : ruleSet.getRules()) {
            results.add(runRule(rule, dataset, idColumn, totalRecords));
        }

        ValidationStatus status = ValidationStatus.derive(results);
        long failedChecks = results.stream().filter(r -> !r.passed()).count();
        log.info("[QUALITY] domain={} source='{}' records={} checks={} failed={} status={}",
                ruleSet.getDomain(), source, totalRecords, results.size(), failedChecks, status);

        return QualityReport.builder()
                .domain(ruleSet.getDomain())
                .source(source != null ? source : "")
                .timestamp(Instant.now(clock))
                .totalRecords(totalRecords)
                .status(status)
                .results(results)
                .metadata(metadata)
                .build();
    }

    private ValidationResult runRule(Rule rule, Dataset dataset, String idColumn, long totalRecords) {
        try {
            RuleOutcome outcome = Objects.requireNonNull(rule.check().evaluate(dataset),
                    "Rule check returned no outcome");
            Dataset failing = outcome.failingRows();
            long recordsFailed = failing.size();
            return ValidationResult.builder()
                    .ruleName(rule.name())
                    .description(rule.description())
                    .severity(rule.severity())
                    .passed(outcome.passed())
                    .recordsChecked(totalRecords)
                    .recordsFailed(recordsFailed)
                    .failurePercentage(ValidationResult.failurePercentage(recordsFailed, totalRecords))
                    .failedRecordIds(failedIds(failing, idColumn))
                    .timestamp(Instant.now(clock))
                    .build();
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("[QUALITY] Rule {} in domain {} could not be evaluated: {}",
                    rule.name(), ruleSet.getDomain(), e.toString());
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ValidationResult.builder()
                    .ruleName(rule.name())
                    .description(rule.description())
                    .severity(Severity.ERROR)
                    .passed(false)
                    .recordsChecked(totalRecords)
                    .recordsFailed(totalRecords)
                    .failurePercentage(ValidationResult.failurePercentage(totalRecords, totalRecords))
                    .details(Map.of("error", error, "error_type", e.getClass().getName()))
                    .timestamp(Instant.now(clock))
                    .build();
        }
    }

    private List<String> failedIds(Dataset failing, String idColumn) {
        if (failing.isEmpty() || idColumn == null || !failing.hasColumn(idColumn)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        for (Object value : failing.column(idColumn)) {
            if (ids.size() >= maxFailedRecordIds) {
                break;
            }
            ids.add(Values.isNull(value) ? null : String.valueOf(value));
        }
        return ids;
    }
}
