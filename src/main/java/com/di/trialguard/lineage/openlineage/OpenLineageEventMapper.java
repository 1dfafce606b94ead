package com.di.trialguard.lineage.openlineage;

import com.di.trialguard.lineage.DataAsset;
import com.di.trialguard.lineage.LineageEvent;
import com.di.trialguard.lineage.LineageProperties;
import io.openlineage.client.OpenLineage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Maps stored lineage events onto OpenLineage run events.
 *
 * <ul>
 *   <li>{@code eventType} is {@code FAIL} when the validation status is {@code failed} or {@code quarantine},
 *       otherwise {@code COMPLETE}.</li>
 *   <li>{@code runId} is the event id when it is a UUID, else a name-based UUID derived from it.</li>
 *   <li>{@code triggered_by} of the form {@code namespace:name} becomes the job; anything else is a job
 *       name in the configured namespace.</li>
 *   <li>Locations of the form {@code scheme://authority/path} split into namespace {@code scheme://authority}
 *       and name {@code path}.</li>
 * </ul>
 */
@Component
public class OpenLineageEventMapper {

    private static final Set<String> FAILING_STATUSES = Set.of("failed", "quarantine");

    private final URI producer;
    private final String defaultNamespace;
    private final OpenLineage openLineage;

    @Autowired
    public OpenLineageEventMapper(LineageProperties properties) {
        this(properties.getOpenlineage().getProducer(), properties.getOpenlineage().getNamespace());
    }

    public OpenLineageEventMapper(String producer, String defaultNamespace) {
        this.producer = URI.create(producer);
        this.defaultNamespace = defaultNamespace;
        this.openLineage = new OpenLineage(this.producer);
    }

    public OpenLineage.RunEvent toRunEvent(LineageEvent event) {
        boolean failed = isFailed(event.validationStatus());
        OpenLineage.Run run = openLineage.newRunBuilder()
                .runId(runId(event.eventId()))
                .facets(runFacets(event, failed))
                .build();
        return openLineage.newRunEventBuilder()
                .eventType(failed ? OpenLineage.RunEvent.EventType.FAIL : OpenLineage.RunEvent.EventType.COMPLETE)
                .eventTime(utc(endTime(event)))
                .run(run)
                .job(job(event.triggeredBy()))
                .inputs(event.inputAssets().stream().map(this::inputDataset).toList())
                .outputs(event.outputAssets().stream().map(asset -> outputDataset(asset, event)).toList())
                .build();
    }

    static boolean isFailed(String validationStatus) {
        return validationStatus != null && FAILING_STATUSES.contains(validationStatus.toLowerCase(Locale.ROOT));
    }

    static UUID runId(String eventId) {
        try {
            return UUID.fromString(eventId);
        } catch (IllegalArgumentException e) {
            return UUID.nameUUIDFromBytes(eventId.getBytes(StandardCharsets.UTF_8));
        }
    }

    OpenLineage.Job job(String triggeredBy) {
        int colon = triggeredBy.indexOf(':');
        String namespace = defaultNamespace;
        String name = triggeredBy;
        if (colon > 0 && colon < triggeredBy.length() - 1) {
            namespace = triggeredBy.substring(0, colon);
            name = triggeredBy.substring(colon + 1);
        }
        return openLineage.newJobBuilder().namespace(namespace).name(name).build();
    }

    /** Splits {@code scheme://authority/path}; other locations live in the default namespace. */
    String[] namespaceAndName(String location) {
        int schemeEnd = location.indexOf("://");
        if (schemeEnd > 0) {
            int pathStart = location.indexOf('/', schemeEnd + 3);
            if (pathStart > schemeEnd + 3 && pathStart < location.length() - 1) {
                return new String[]{location.substring(0, pathStart), location.substring(pathStart + 1)};
            }
        }
        return new String[]{defaultNamespace, location};
    }

    private OpenLineage.InputDataset inputDataset(DataAsset asset) {
        String[] parts = namespaceAndName(asset.location());
        return openLineage.newInputDatasetBuilder()
                .namespace(parts[0])
                .name(parts[1])
                .facets(datasetFacets(asset, null))
                .build();
    }

    private OpenLineage.OutputDataset outputDataset(DataAsset asset, LineageEvent producedBy) {
        String[] parts = namespaceAndName(asset.location());
        return openLineage.newOutputDatasetBuilder()
                .namespace(parts[0])
                .name(parts[1])
                .facets(datasetFacets(asset, producedBy))
                .build();
    }

    private OpenLineage.DatasetFacets datasetFacets(DataAsset asset, LineageEvent producedBy) {
        OpenLineage.DatasetFacetsBuilder facets = openLineage.newDatasetFacetsBuilder();
        if (asset.schemaHash() != null) {
            facets.put(SchemaHashDatasetFacet.NAME, SchemaHashDatasetFacet.builder(producer)
                    .schemaHash(asset.schemaHash())
                    .build());
        }
        if (producedBy != null && producedBy.validationStatus() != null) {
            facets.put(DataQualityDatasetFacet.NAME, DataQualityDatasetFacet.builder(producer)
                    .status(producedBy.validationStatus())
                    .rowCount(asset.recordCount() != null ? asset.recordCount() : producedBy.recordsOut())
                    .rejectedCount(producedBy.recordsRejected())
                    .build());
        }
        return facets.build();
    }

    private OpenLineage.RunFacets runFacets(LineageEvent event, boolean failed) {
        OpenLineage.RunFacetsBuilder facets = openLineage.newRunFacetsBuilder()
                .nominalTime(openLineage.newNominalTimeRunFacet(utc(event.timestamp()), utc(endTime(event))))
                .put(ProcessingStatsRunFacet.NAME, ProcessingStatsRunFacet.builder(producer)
                        .rowsRead(event.recordsIn())
                        .rowsWritten(event.recordsOut())
                        .rowsRejected(event.recordsRejected())
                        .build());
        if (failed) {
            facets.errorMessage(openLineage.newErrorMessageRunFacet(
                    "Validation status: " + event.validationStatus(), "java", null));
        }
        return facets.build();
    }

    private static ZonedDateTime utc(Instant instant) {
        return instant.atZone(ZoneOffset.UTC);
    }

    private static Instant endTime(LineageEvent event) {
        if (event.durationSeconds() == null) {
            return event.timestamp();
        }
        return event.timestamp().plusNanos(Math.round(event.durationSeconds() * 1_000_000_000L));
    }
}
