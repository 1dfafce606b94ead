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
 * Contract schema hash of a dataset, so consumers can tell which contract shape the data was checked against.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SchemaHashDatasetFacet implements OpenLineage.DatasetFacet {

    public static final String NAME = "trialguard_schemaHash";

    private static final URI SCHEMA_URL =
            URI.create("https://trialguard.di.com/openlineage/facets/SchemaHashDatasetFacet.json");

    @Getter(AccessLevel.NONE)
    @JsonProperty("_producer")
    private final URI producer;

    @Getter(AccessLevel.NONE)
    @JsonProperty("_schemaURL")
    private final URI schemaURL;

    @Getter(AccessLevel.NONE)
    @JsonProperty("_deleted")
    private final Boolean deleted;

    @JsonProperty("schemaHash")
    private final String schemaHash;

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

    public static SchemaHashDatasetFacetBuilder builder(URI producer) {
        return new SchemaHashDatasetFacetBuilder().producer(producer).schemaURL(SCHEMA_URL);
    }
}
