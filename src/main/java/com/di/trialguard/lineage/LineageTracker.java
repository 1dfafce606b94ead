package com.di.trialguard.lineage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Single-use builder of one {@link LineageEvent}. Each pipeline step creates its own tracker, registers
 * inputs and outputs while it runs, then calls {@link #buildEvent()} once.
 *
 * <p>Not thread-safe. After {@code buildEvent()} every mutator, and {@code buildEvent()} itself, throws
 * {@link LineageTrackerStateException}.
 *
 * <pre>{@code
 * LineageTracker tracker = new LineageTracker("glue:bronze_to_silver", LineageEventType.TRANSFORMATION);
 * tracker.addInput(DataAsset.fromLocation("s3://bucket/bronze/dm/dm.parquet", DataLayer.BRONZE, 1000L));
 * tracker.setTransformation("CDISC standardization", Map.of("cdisc_version", "3.3"));
 * tracker.addOutput(DataAsset.fromLocation("s3://bucket/silver/dm/dm.parquet", DataLayer.SILVER, 995L));
 * LineageEvent event = tracker.buildEvent();
 * }</pre>
 */
public class LineageTracker {

    enum State { OPEN, FINALIZED }

    private final String eventId;
    private final LineageEventType eventType;
    private final String triggeredBy;
    private final Clock clock;
    private final Instant startTime;

    private final List<DataAsset> inputAssets = new ArrayList<>();
    private final List<DataAsset> outputAssets = new ArrayList<>();
    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private String transformationLogic;
    private String validationStatus;
    private String executionId;
    private long recordsIn;
    private long recordsOut;
    private long recordsRejected;

    private State state = State.OPEN;

    public LineageTracker(String triggeredBy) {
        this(triggeredBy, LineageEventType.TRANSFORMATION);
    }

    public LineageTracker(String triggeredBy, LineageEventType eventType) {
        this(triggeredBy, eventType, Clock.systemUTC());
    }

    public LineageTracker(String triggeredBy, LineageEventType eventType, Clock clock) {
        if (triggeredBy == null || triggeredBy.isBlank()) {
            throw new IllegalArgumentException("triggeredBy cannot be null or blank");
        }
        this.triggeredBy = triggeredBy;
        this.eventType = Objects.requireNonNull(eventType, "eventType");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.eventId = UUID.randomUUID().toString();
        this.startTime = clock.instant();
    }

    public String getEventId() {
        return eventId;
    }

    State getState() {
        return state;
    }

    /** Appends an input; a positive record count is added to {@code records_in}. */
    public LineageTracker addInput(DataAsset asset) {
        requireOpen("addInput");
        inputAssets.add(Objects.requireNonNull(asset, "asset"));
        recordsIn += positiveCount(asset);
        return this;
    }

    /** Appends an output; a positive record count is added to {@code records_out}. */
    public LineageTracker addOutput(DataAsset asset) {
        requireOpen("addOutput");
        outputAssets.add(Objects.requireNonNull(asset, "asset"));
        recordsOut += positiveCount(asset);
        return this;
    }

    public LineageTracker setTransformation(String description) {
        return setTransformation(description, null);
    }

    /** Non-empty parameters replace any set earlier. */
    public LineageTracker setTransformation(String description, Map<String, ?> parameters) {
        requireOpen("setTransformation");
        this.transformationLogic = description;
        if (parameters != null && !parameters.isEmpty()) {
            this.parameters.clear();
            this.parameters.putAll(parameters);
        }
        return this;
    }

    public LineageTracker setValidationStatus(String status, long rejectedCount) {
        requireOpen("setValidationStatus");
        if (rejectedCount < 0) {
            throw new IllegalArgumentException("rejectedCount must be >= 0, got " + rejectedCount);
        }
        this.validationStatus = status;
        this.recordsRejected = rejectedCount;
        return this;
    }

    public LineageTracker setExecutionId(String executionId) {
        requireOpen("setExecutionId");
        this.executionId = executionId;
        return this;
    }

    /**
     * Finalizes the tracker. The event is stamped with the tracker's start time and the seconds elapsed
     * since construction.
     */
    public LineageEvent buildEvent() {
        requireOpen("buildEvent");
        state = State.FINALIZED;
        double durationSeconds = Duration.between(startTime, clock.instant()).toNanos() / 1_000_000_000.0;
        return LineageEvent.builder()
                .eventId(eventId)
                .eventType(eventType)
                .timestamp(startTime)
                .triggeredBy(triggeredBy)
                .inputAssets(inputAssets)
                .outputAssets(outputAssets)
                .transformationLogic(transformationLogic)
                .parameters(parameters)
                .validationStatus(validationStatus)
                .recordsIn(recordsIn)
                .recordsOut(recordsOut)
                .recordsRejected(recordsRejected)
                .executionId(executionId)
                .durationSeconds(durationSeconds)
                .build();
    }

    private void requireOpen(String operation) {
        switch (state) {
            case OPEN -> { }
            case FINALIZED -> throw new LineageTrackerStateException(String.format(
                    "Cannot %s: lineage tracker for event %s was already finalized", operation, eventId));
        }
    }

    private static long positiveCount(DataAsset asset) {
        Long count = asset.recordCount();
        return count != null && count > 0 ? count : 0;
    }
}
