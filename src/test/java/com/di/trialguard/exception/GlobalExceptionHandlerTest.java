package com.di.trialguard.exception;

import com.di.trialguard.config.MdcRequestFilter;
import com.di.trialguard.lineage.InMemoryLineageEventStore;
import com.di.trialguard.lineage.LineageController;
import com.di.trialguard.lineage.LineageProperties;
import com.di.trialguard.lineage.LineageService;
import com.di.trialguard.lineage.openlineage.OpenLineageEventMapper;
import com.di.trialguard.quality.QualityController;
import com.di.trialguard.quality.QualityProperties;
import com.di.trialguard.quality.QualityValidationService;
import com.di.trialguard.quality.RuleSetRegistry;
import com.di.trialguard.quality.rules.DemographicsRules;
import com.di.trialguard.util.GovernanceMetrics;
import com.di.trialguard.util.JsonSupport;
import com.di.trialguard.util.TransactionEventLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.lang.reflect.Method;
import java.time.Clock;
import java.util.List;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Controllers and error mapping over MockMvc, without an application context.
 */
@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

    private static final String DM_BODY = """
            {"source": "s3://b/silver/dm",
             "dataset": {"rows": [
               {"USUBJID": "TG-001-001", "AGE": 34, "SEX": "F", "ARM": "PLACEBO", "RFSTDTC": "2024-01-15"}
             ]}}
            """;

    private static final String EVENT_BODY = """
            {"event_id": "evt-1", "event_type": "transformation", "timestamp": "2024-01-15T10:30:00Z",
             "triggered_by": "airflow:dm_pipeline",
             "input_assets": [{"location": "s3://b/bronze/dm.csv", "layer": "bronze"}],
             "output_assets": [{"location": "s3://b/silver/dm.parquet", "layer": "silver"}],
             "validation_status": "passed", "records_in": 10, "records_out": 10, "records_rejected": 0}
            """;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() throws Exception {
        GovernanceMetrics metrics = new GovernanceMetrics(new SimpleMeterRegistry());
        RuleSetRegistry ruleSets = new RuleSetRegistry(List.of(new DemographicsRules()));
        Method initialize = RuleSetRegistry.class.getDeclaredMethod("initialize");
        initialize.setAccessible(true);
        initialize.invoke(ruleSets);

        QualityValidationService qualityService =
                new QualityValidationService(ruleSets, new QualityProperties(), metrics, Clock.systemUTC());
        LineageService lineageService =
                new LineageService(new InMemoryLineageEventStore(), new LineageProperties(), metrics);

        mockMvc = MockMvcBuilders
                .standaloneSetup(new QualityController(qualityService),
                        new LineageController(lineageService,
                                new OpenLineageEventMapper("urn:test", "trialguard")))
                .setControllerAdvice(new GlobalExceptionHandler(new TransactionEventLogger(), "trialguard"))
                .setMessageConverters(new StringHttpMessageConverter(),
                        new MappingJackson2HttpMessageConverter(JsonSupport.newObjectMapper()))
                .addFilters(new MdcRequestFilter())
                .build();
    }

    @Test
    @DisplayName("Should return the quality report with 200")
    void testValidate_Ok() throws Exception {
        mockMvc.perform(post("/api/quality/DM/validate").contentType(MediaType.APPLICATION_JSON).content(DM_BODY))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", startsWith("req-")))
                .andExpect(jsonPath("$.status").value("passed"))
                .andExpect(jsonPath("$.total_records").value(1))
                .andExpect(jsonPath("$.results.length()").value(6));
    }

    @Test
    @DisplayName("Should map an unknown domain to 404 with the domain in the details")
    void testValidate_UnknownDomain() throws Exception {
        mockMvc.perform(post("/api/quality/XX/validate").contentType(MediaType.APPLICATION_JSON).content(DM_BODY)
                        .header("X-Request-Id", "caller-7"))
                .andExpect(status().isNotFound())
                .andExpect(header().string("X-Request-Id", "caller-7"))
                .andExpect(jsonPath("$.errorCategory").value("DOMAIN_ERROR"))
                .andExpect(jsonPath("$.details.domain").value("XX"))
                .andExpect(jsonPath("$.path").value("/api/quality/XX/validate"));
    }

    @Test
    @DisplayName("Should report missing body fields as 400 field errors")
    void testValidate_MissingDataset() throws Exception {
        mockMvc.perform(post("/api/quality/DM/validate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\": \"api\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.dataset").exists());
    }

    @Test
    @DisplayName("Should report unreadable JSON as a 400 serialization error")
    void testValidate_Unreadable() throws Exception {
        mockMvc.perform(post("/api/quality/DM/validate").contentType(MediaType.APPLICATION_JSON).content("{"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("SERIALIZATION_ERROR"));
    }

    @Test
    @DisplayName("Should record an event and serve it natively and as OpenLineage")
    void testLineage_RecordAndFetch() throws Exception {
        mockMvc.perform(post("/api/lineage/events").contentType(MediaType.APPLICATION_JSON).content(EVENT_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.event_type").value("transformation"));

        mockMvc.perform(get("/api/lineage/events/evt-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output_assets[0].name").value("dm.parquet"));
        mockMvc.perform(get("/api/lineage/events/evt-1/openlineage"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", startsWith(MediaType.APPLICATION_JSON_VALUE)))
                .andExpect(jsonPath("$.eventType").value("COMPLETE"))
                .andExpect(jsonPath("$.job.namespace").value("airflow"));
        mockMvc.perform(get("/api/lineage/upstream").param("location", "s3://b/silver/dm.parquet"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].event_id").value("evt-1"));
    }

    @Test
    @DisplayName("Should reject a duplicate event id with 400")
    void testLineage_Duplicate() throws Exception {
        mockMvc.perform(post("/api/lineage/events").contentType(MediaType.APPLICATION_JSON).content(EVENT_BODY))
                .andExpect(status().isCreated());
        mockMvc.perform(post("/api/lineage/events").contentType(MediaType.APPLICATION_JSON).content(EVENT_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Should return 404 for an unknown event and 400 for bad query parameters")
    void testLineage_Errors() throws Exception {
        mockMvc.perform(get("/api/lineage/events/missing"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/lineage/upstream").param("location", "x").param("depth", "-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("VALIDATION_ERROR"));
        mockMvc.perform(get("/api/lineage/downstream"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/lineage/downstream").param("location", "x").param("depth", "deep"))
                .andExpect(status().isBadRequest());
    }
}
