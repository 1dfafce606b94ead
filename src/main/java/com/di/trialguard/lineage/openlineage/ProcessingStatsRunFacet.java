package com.di.trialguard.lineage.openlineage;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.openlineage.client.OpenLineage;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * Record counts of one governed step: rows read from the inputs, written to the outputs, and rejected.
 */
@Getter
@Builder
public class ProcessingStatsRunFacet implements OpenLineage.RunFacet {

    public static final String NAME = "processingStats";

    private static final URI SCHEMA_URL =
            URI.create("https://trialguard.di.com/openlineage/facets/ProcessingStatsRunFacet.json");

    @Getter(AccessLevel.NONE)
    @JsonProperty("_producer")
    private final URI producer;

    @Getter(AccessLevel.NONE)
    @JsonProperty("_schemaURL")
    private final URI schemaURL;

    @JsonProperty("rowsRead")
    private final long rowsRead;

    @JsonProperty("rowsWritten")
    private final long rowsWritten;

    @JsonProperty("rowsRejected")
    private final long rowsRejected;

    @Override
    public URI get_producer() {
        return producer;
    }

    @Override
    public URI get_schemaURL() {
        return schemaURL != null ? schemaURL : SCHEMA_URL;
    }

    @Override
    public Map<String, Object> getAdditionalProperties() {
        return new HashMap<>();
    }

    public static ProcessingStatsRunFacetBuilder builder(URI producer) {
        return new ProcessingStatsRunFacetBuilder().producer(producer).schemaURL(SCHEMA_URL);
    }
}
