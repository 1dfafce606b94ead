package com.di.trialguard.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete, immutable result of evaluating a dataset against one contract version.
 */
@Builder
@JsonPropertyOrder({"contract_name", "contract_version", "contract_domain", "schema_hash", "timestamp",
        "schema_changes", "has_breaking_changes", "value_validation", "total_records", "failed_records",
        "is_valid", "action"})
public record ContractValidationResult(
        @JsonProperty("contract_name") String contractName,
        @JsonProperty("contract_version") String contractVersion,
        @JsonProperty("contract_domain") String contractDomain,
        @JsonProperty("schema_hash") String schemaHash,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("schema_changes") List<SchemaChange> schemaChanges,
        @JsonProperty("has_breaking_changes") boolean hasBreakingChanges,
        @JsonProperty("value_validation") Map<String, ColumnValidation> valueValidation,
        @JsonProperty("total_records") long totalRecords,
        @JsonProperty("failed_records") long failedRecords,
        @JsonProperty("is_valid") boolean valid,
        @JsonProperty("action") ContractAction action) {

    public ContractValidationResult {
        schemaChanges = schemaChanges != null ? List.copyOf(schemaChanges) : List.of();
        valueValidation = valueValidation != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(valueValidation))
                : Map.of();
    }
}
