package com.di.trialguard.quality;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one rule against one dataset. Immutable once created.
 *
 * @param failurePercentage {@code recordsFailed / recordsChecked * 100}, rounded to two decimals;
 *                          {@code 0} when no records were checked
 * @param failedRecordIds   identifiers of the first failing records (bounded by the engine)
 * @param details           extra context, e.g. the error of a rule that could not be evaluated
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ValidationResult(
        @JsonProperty("rule_name") String ruleName,
        @JsonProperty("description") String description,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("passed") boolean passed,
        @JsonProperty("records_checked") long recordsChecked,
        @JsonProperty("records_failed") long recordsFailed,
        @JsonProperty("failure_percentage") double failurePercentage,
        @JsonProperty("failed_record_ids") List<String> failedRecordIds,
        @JsonProperty("details") Map<String, String> details,
        @JsonProperty("timestamp") Instant timestamp) {

    public ValidationResult {
        failedRecordIds = failedRecordIds == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(failedRecordIds));
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Percentage of failed records, two decimals, guarded against an empty dataset.
     */
    public static double failurePercentage(long recordsFailed, long recordsChecked) {
        if (recordsChecked <= 0) {
            return 0.0;
        }
        double pct = (double) recordsFailed / recordsChecked * 100.0;
        return Math.round(pct * 100.0) / 100.0;
    }
}
