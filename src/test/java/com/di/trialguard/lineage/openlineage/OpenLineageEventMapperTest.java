package com.di.trialguard.lineage.openlineage;

import com.di.trialguard.lineage.DataAsset;
import com.di.trialguard.lineage.DataLayer;
import com.di.trialguard.lineage.LineageEvent;
import com.di.trialguard.lineage.LineageEventType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.openlineage.client.OpenLineage;
import io.openlineage.client.OpenLineageClientUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.URI;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OpenLineageEventMapper Tests")
class OpenLineageEventMapperTest {

    private final OpenLineageEventMapper mapper = new OpenLineageEventMapper("urn:test", "trialguard");

    private static LineageEvent event(String eventId, String triggeredBy, String validationStatus) {
        return LineageEvent.builder()
                .eventId(eventId)
                .eventType(LineageEventType.PROMOTION)
                .timestamp(Instant.parse("2024-01-15T08:00:00Z"))
                .triggeredBy(triggeredBy)
                .inputAssets(List.of(DataAsset.fromLocation("s3://clinical-bucket/silver/dm/dm.parquet", DataLayer.SILVER, 100L)))
                .outputAssets(List.of(DataAsset.fromLocation("gold/dm", DataLayer.GOLD, 95L).toBuilder()
                        .schemaHash("abcd1234").build()))
                .validationStatus(validationStatus)
                .recordsIn(100)
                .recordsOut(95)
                .recordsRejected(5)
                .durationSeconds(1.5)
                .build();
    }

    @Test
    @DisplayName("Should map a completed event with job, run and datasets")
    void testToRunEvent_Complete() {
        String id = UUID.randomUUID().toString();
        OpenLineage.RunEvent run = mapper.toRunEvent(event(id, "glue:silver_to_gold", "promote"));

        assertEquals(OpenLineage.RunEvent.EventType.COMPLETE, run.getEventType());
        assertEquals(Instant.parse("2024-01-15T08:00:01.500Z"), run.getEventTime().toInstant());
        assertEquals(URI.create("urn:test"), run.getProducer());
        assertNotNull(run.getSchemaURL());
        assertEquals("glue", run.getJob().getNamespace());
        assertEquals("silver_to_gold", run.getJob().getName());
        assertEquals(UUID.fromString(id), run.getRun().getRunId());

        OpenLineage.InputDataset input = run.getInputs().get(0);
        assertEquals("s3://clinical-bucket", input.getNamespace());
        assertEquals("silver/dm/dm.parquet", input.getName());
        assertTrue(input.getFacets().getAdditionalProperties().isEmpty());

        OpenLineage.OutputDataset output = run.getOutputs().get(0);
        assertEquals("trialguard", output.getNamespace());
        assertEquals("gold/dm", output.getName());
        DataQualityDatasetFacet quality = (DataQualityDatasetFacet) output.getFacets().getAdditionalProperties()
                .get(DataQualityDatasetFacet.NAME);
        assertEquals("promote", quality.getStatus());
        assertEquals(95L, quality.getRowCount());
        assertEquals(5L, quality.getRejectedCount());
        SchemaHashDatasetFacet schemaHash = (SchemaHashDatasetFacet) output.getFacets().getAdditionalProperties()
                .get(SchemaHashDatasetFacet.NAME);
        assertEquals("abcd1234", schemaHash.getSchemaHash());

        OpenLineage.RunFacets runFacets = run.getRun().getFacets();
        assertEquals(Instant.parse("2024-01-15T08:00:00Z"), runFacets.getNominalTime().getNominalStartTime().toInstant());
        assertEquals(Instant.parse("2024-01-15T08:00:01.500Z"), runFacets.getNominalTime().getNominalEndTime().toInstant());
        assertNull(runFacets.getErrorMessage());
        ProcessingStatsRunFacet stats = (ProcessingStatsRunFacet) runFacets.getAdditionalProperties()
                .get(ProcessingStatsRunFacet.NAME);
        assertEquals(100, stats.getRowsRead());
        assertEquals(95, stats.getRowsWritten());
        assertEquals(5, stats.getRowsRejected());
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({"failed, FAIL", "QUARANTINE, FAIL", "passed, COMPLETE", "alert, COMPLETE"})
    @DisplayName("Should map failing validation statuses to FAIL")
    void testEventType(String status, OpenLineage.RunEvent.EventType expected) {
        OpenLineage.RunEvent run = mapper.toRunEvent(event("e-1", "job", status));
        assertEquals(expected, run.getEventType());
        OpenLineage.ErrorMessageRunFacet error = run.getRun().getFacets().getErrorMessage();
        if (expected == OpenLineage.RunEvent.EventType.FAIL) {
            assertEquals("Validation status: " + status, error.getMessage());
            assertEquals("java", error.getProgrammingLanguage());
        } else {
            assertNull(error);
        }
    }

    @Test
    @DisplayName("Should derive a stable run id from a non-UUID event id")
    void testRunId_NameBased() {
        UUID runId = OpenLineageEventMapper.runId("evt-42");
        assertEquals(runId, OpenLineageEventMapper.runId("evt-42"));
        assertEquals(3, runId.version());
    }

    @Test
    @DisplayName("Should place an unqualified trigger in the default namespace")
    void testJob_DefaultNamespace() {
        OpenLineage.Job nightly = mapper.job("nightly");
        assertEquals("trialguard", nightly.getNamespace());
        assertEquals("nightly", nightly.getName());
        OpenLineage.Job trailing = mapper.job("trailing:");
        assertEquals("trialguard", trailing.getNamespace());
        assertEquals("trailing:", trailing.getName());
    }

    @Test
    @DisplayName("Should omit the quality facet when no validation status was recorded")
    void testNoValidationStatus() {
        OpenLineage.RunEvent run = mapper.toRunEvent(event("e-2", "job", null));
        assertEquals(OpenLineage.RunEvent.EventType.COMPLETE, run.getEventType());
        assertFalse(run.getOutputs().get(0).getFacets().getAdditionalProperties()
                .containsKey(DataQualityDatasetFacet.NAME));
    }

    @Test
    @DisplayName("Should serialize with OpenLineage field names")
    void testJsonShape() throws Exception {
        ObjectMapper json = OpenLineageClientUtils.newObjectMapper();
        JsonNode node = json.readTree(OpenLineageClientUtils.toJson(mapper.toRunEvent(event("e-3", "glue:job", "failed"))));

        assertEquals("FAIL", node.get("eventType").asText());
        assertEquals(Instant.parse("2024-01-15T08:00:01.500Z"),
                ZonedDateTime.parse(node.get("eventTime").asText()).toInstant());
        assertTrue(node.has("schemaURL"));
        assertEquals("glue", node.at("/job/namespace").asText());
        assertEquals(100, node.at("/run/facets/processingStats/rowsRead").asLong());
        assertEquals("urn:test", node.at("/run/facets/processingStats/_producer").asText());
        assertEquals("java", node.at("/run/facets/errorMessage/programmingLanguage").asText());
        assertEquals("failed", node.at("/outputs/0/facets/dataQuality/status").asText());
        assertEquals(5, node.at("/outputs/0/facets/dataQuality/rejectedCount").asLong());
        assertEquals("abcd1234", node.at("/outputs/0/facets/trialguard_schemaHash/schemaHash").asText());
    }
}
