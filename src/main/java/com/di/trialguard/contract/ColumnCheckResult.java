package com.di.trialguard.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/**
 * Outcome of one contract clause on one column. The bound or allow-list that was checked is echoed back.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnCheckResult(
        @JsonProperty("check") ContractCheck check,
        @JsonProperty("passed") boolean passed,
        @JsonProperty("failed_count") long failedCount,
        @JsonProperty("allowed") List<String> allowed,
        @JsonProperty("min") Double min,
        @JsonProperty("max") Double max) {
}
