package com.di.trialguard.lineage;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node of the lineage graph: a file, table or dataset identified by its location.
 * Assets are value objects; the location string is the graph key.
 */
@Builder(toBuilder = true)
public record DataAsset(
        @JsonProperty("asset_id") String assetId,
        @JsonProperty("name") String name,
        @JsonProperty("asset_type") String assetType,
        @JsonProperty("location") String location,
        @JsonProperty("layer") DataLayer layer,
        @JsonProperty("schema_hash") String schemaHash,
        @JsonProperty("record_count") Long recordCount,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("metadata") Map<String, String> metadata) {

    public static final String TYPE_FILE = "file";

    public DataAsset {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Asset location cannot be null or blank");
        }
        assetId = assetId != null ? assetId : idFor(location);
        name = name != null ? name : nameFor(location);
        assetType = assetType != null ? assetType : TYPE_FILE;
        createdAt = createdAt != null ? createdAt : Instant.now();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    /**
     * Asset for a file or prefix location. The name is the last path segment and the id the first
     * 12 hex characters of the MD5 of the location, so the same location always yields the same id.
     */
    public static DataAsset fromLocation(String location, DataLayer layer, Long recordCount) {
        return DataAsset.builder()
                .location(location)
                .layer(layer)
                .recordCount(recordCount)
                .build();
    }

    static String idFor(String location) {
        return DigestUtils.md5DigestAsHex(location.getBytes(StandardCharsets.UTF_8)).substring(0, 12);
    }

    static String nameFor(String location) {
        int slash = location.lastIndexOf('/');
        return slash >= 0 ? location.substring(slash + 1) : location;
    }
}
