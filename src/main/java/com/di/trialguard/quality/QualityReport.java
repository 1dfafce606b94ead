package com.di.trialguard.quality;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Quality verdict for one dataset: per-rule results in registration order plus the derived status.
 * Created once per validation run and serialised for the audit trail.
 */
@Builder(toBuilder = true)
@JsonPropertyOrder({"domain", "source", "timestamp", "total_records", "status", "summary", "results", "metadata"})
@JsonIgnoreProperties(value = "summary", allowGetters = true)
public record QualityReport(
        @JsonProperty("domain") String domain,
        @JsonProperty("source") String source,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("total_records") long totalRecords,
        @JsonProperty("status") ValidationStatus status,
        @JsonProperty("results") List<ValidationResult> results,
        @JsonProperty("metadata") Map<String, String> metadata) {

    public QualityReport {
        results = results == null ? List.of() : List.copyOf(results);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** Counts of checks by outcome, written alongside the results for dashboards. */
    @JsonProperty("summary")
    public Map<String, Long> summary() {
        Map<String, Long> summary = new LinkedHashMap<>();
        summary.put("total_checks", (long) results.size());
        summary.put("passed", results.stream().filter(ValidationResult::passed).count());
        summary.put("failed", results.stream().filter(r -> !r.passed()).count());
        summary.put("errors", countFailed(Severity.ERROR));
        summary.put("warnings", countFailed(Severity.WARNING));
        return summary;
    }

    private long countFailed(Severity severity) {
        return results.stream()
                .filter(r -> !r.passed() && r.severity() == severity)
                .count();
    }
}
