package com.di.trialguard.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * All clause results for one column. {@code failed_count} is the sum over the clauses, so a row failing
 * two clauses counts twice.
 */
public record ColumnValidation(
        @JsonProperty("column") String column,
        @JsonProperty("checks") List<ColumnCheckResult> checks,
        @JsonProperty("failed_count") long failedCount) {

    public ColumnValidation {
        checks = checks != null ? List.copyOf(checks) : List.of();
    }

    public static ColumnValidation of(String column, List<ColumnCheckResult> checks) {
        long failed = checks.stream().mapToLong(ColumnCheckResult::failedCount).sum();
        return new ColumnValidation(column, checks, failed);
    }

    public boolean passed() {
        return failedCount == 0;
    }
}
