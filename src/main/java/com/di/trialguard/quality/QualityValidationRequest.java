package com.di.trialguard.quality;

import com.di.trialguard.dataset.DatasetPayload;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * REST request body for {@code POST /api/quality/{domain}/validate}.
 */
public record QualityValidationRequest(
        @JsonProperty("source") String source,
        @JsonProperty("id_column") String idColumn,
        @JsonProperty("metadata") Map<String, String> metadata,
        @NotNull @JsonProperty("dataset") DatasetPayload dataset) {
}
