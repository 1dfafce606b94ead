package com.di.trialguard.governance;

import com.di.trialguard.dataset.DatasetPayload;
import com.di.trialguard.lineage.DataLayer;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.util.Map;

/**
 * REST request body for {@code POST /api/governance/promote}.
 * Both checks run unless switched off; at least one must stay on.
 */
@Builder
public record PromotionRequest(
        @NotBlank @JsonProperty("domain") String domain,
        @NotBlank @JsonProperty("source_location") String sourceLocation,
        @JsonProperty("source_layer") DataLayer sourceLayer,
        @NotBlank @JsonProperty("target_location") String targetLocation,
        @JsonProperty("target_layer") DataLayer targetLayer,
        @JsonProperty("id_column") String idColumn,
        @JsonProperty("run_quality") Boolean runQuality,
        @JsonProperty("run_contract") Boolean runContract,
        @JsonProperty("execution_id") String executionId,
        @JsonProperty("metadata") Map<String, String> metadata,
        @NotNull @JsonProperty("dataset") DatasetPayload dataset) {

    public boolean qualityEnabled() {
        return runQuality == null || runQuality;
    }

    public boolean contractEnabled() {
        return runContract == null || runContract;
    }
}
