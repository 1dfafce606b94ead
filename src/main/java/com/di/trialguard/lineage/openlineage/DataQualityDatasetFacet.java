package com.di.trialguard.lineage.openlineage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.openlineage.client.OpenLineage;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * Validation verdict attached to an output dataset: the status recorded on the lineage event,
 * the dataset's row count and how many rows were rejected.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataQualityDatasetFacet implements OpenLineage.DatasetFacet {

    public static final String NAME = "dataQuality";

    private static final URI SCHEMA_URL =
            URI.create("https://trialguard.di.com/openlineage/facets/DataQualityDatasetFacet.json");

    @Getter(AccessLevel.NONE)
    @JsonProperty("_producer")
    private final URI producer;

    @Getter(AccessLevel.NONE)
    @JsonProperty("_schemaURL")
    private final URI schemaURL;

    @Getter(AccessLevel.NONE)
    @JsonProperty("_deleted")
    private final Boolean deleted;

    @JsonProperty("status")
    private final String status;

    @JsonProperty("rowCount")
    private final Long rowCount;

    @JsonProperty("rejectedCount")
    private final Long rejectedCount;

    @Override
    public URI get_producer() {
        return producer;
    }

    @Override
    public URI get_schemaURL() {
        return schemaURL != null ? schemaURL : SCHEMA_URL;
    }

    @Override
    public Boolean get_deleted() {
        return deleted;
    }

    @Override
    public Map<String, Object> getAdditionalProperties() {
        return new HashMap<>();
    }

    public static DataQualityDatasetFacetBuilder builder(URI producer) {
        return new DataQualityDatasetFacetBuilder().producer(producer).schemaURL(SCHEMA_URL);
    }
}
