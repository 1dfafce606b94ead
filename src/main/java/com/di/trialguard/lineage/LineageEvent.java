package com.di.trialguard.lineage;

import com.di.trialguard.util.JsonSupport;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One finalized step of the pipeline: the edges {@code input.location -> event -> output.location} for every
 * input/output pair, plus what was done and how many records moved. Built by {@link LineageTracker};
 * immutable afterwards.
 *
 * <p>{@code parameters} are held in their JSON form (whole numbers as the smallest of int/long, decimals as
 * double, temporals as ISO strings), so an event read back from a store equals the one that was written.
 */
@Builder(toBuilder = true)
@JsonPropertyOrder({"event_id", "event_type", "timestamp", "triggered_by", "input_assets", "output_assets",
        "transformation_logic", "parameters", "validation_status", "records_in", "records_out",
        "records_rejected", "execution_id", "duration_seconds"})
public record LineageEvent(
        @JsonProperty("event_id") String eventId,
        @JsonProperty("event_type") LineageEventType eventType,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("triggered_by") String triggeredBy,
        @JsonProperty("input_assets") List<DataAsset> inputAssets,
        @JsonProperty("output_assets") List<DataAsset> outputAssets,
        @JsonProperty("transformation_logic") String transformationLogic,
        @JsonProperty("parameters") Map<String, Object> parameters,
        @JsonProperty("validation_status") String validationStatus,
        @JsonProperty("records_in") long recordsIn,
        @JsonProperty("records_out") long recordsOut,
        @JsonProperty("records_rejected") long recordsRejected,
        @JsonProperty("execution_id") String executionId,
        @JsonProperty("duration_seconds") Double durationSeconds) {

    private static final ObjectMapper PARAMETER_MAPPER = JsonSupport.newObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> PARAMETER_TYPE = new TypeReference<>() {
    };

    public LineageEvent {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Lineage event_id cannot be null or blank");
        }
        Objects.requireNonNull(eventType, "event_type");
        Objects.requireNonNull(timestamp, "timestamp");
        inputAssets = inputAssets != null ? List.copyOf(inputAssets) : List.of();
        outputAssets = outputAssets != null ? List.copyOf(outputAssets) : List.of();
        parameters = parameters != null ? Collections.unmodifiableMap(asJson(parameters)) : Map.of();
    }

    private static LinkedHashMap<String, Object> asJson(Map<String, Object> parameters) {
        try {
            return PARAMETER_MAPPER.readValue(PARAMETER_MAPPER.writeValueAsBytes(parameters), PARAMETER_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Lineage parameters are not JSON-serializable: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException("Lineage parameters could not be normalized", e);
        }
    }
}
