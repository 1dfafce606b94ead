package com.di.trialguard.governance;

import com.di.trialguard.contract.ContractValidationResult;
import com.di.trialguard.lineage.LineageEvent;
import com.di.trialguard.quality.QualityReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Decision of the promotion gate with the artifacts it was derived from. A skipped check leaves its
 * artifact {@code null}.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PromotionResult(
        @JsonProperty("domain") String domain,
        @JsonProperty("decision") PromotionDecision decision,
        @JsonProperty("output_location") String outputLocation,
        @JsonProperty("quality_report") QualityReport qualityReport,
        @JsonProperty("contract_result") ContractValidationResult contractResult,
        @JsonProperty("lineage_event") LineageEvent lineageEvent) {
}
