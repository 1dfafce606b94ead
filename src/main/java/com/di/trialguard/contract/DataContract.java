package com.di.trialguard.contract;

import com.di.trialguard.util.JsonSupport;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A versioned schema contract for one domain. Immutable per version.
 *
 * <p>The constructor rejects definitions that could never be evaluated meaningfully (duplicate column
 * names, keys referencing undeclared columns, malformed foreign-key targets) with
 * {@link MalformedContractException}.
 */
@Builder
public record DataContract(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("domain") String domain,
        @JsonProperty("description") String description,
        @JsonProperty("owner") String owner,
        @JsonProperty("columns") List<ColumnContract> columns,
        @JsonProperty("compatibility_mode") CompatibilityMode compatibilityMode,
        @JsonProperty("primary_key") List<String> primaryKey,
        @JsonProperty("foreign_keys") Map<String, String> foreignKeys,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    private static final ObjectMapper HASH_MAPPER = JsonSupport.newObjectMapper();

    public DataContract {
        requireText(name, "name");
        requireText(version, "version");
        requireText(domain, "domain");
        if (columns == null || columns.isEmpty()) {
            throw new MalformedContractException("Contract '" + name + "' declares no columns");
        }
        columns = List.copyOf(columns);
        Set<String> names = new LinkedHashSet<>();
        for (ColumnContract column : columns) {
            if (!names.add(column.name())) {
                throw new MalformedContractException(
                        "Contract '" + name + "' declares column '" + column.name() + "' more than once");
            }
        }

        primaryKey = primaryKey != null ? List.copyOf(primaryKey) : List.of();
        for (String key : primaryKey) {
            if (!names.contains(key)) {
                throw new MalformedContractException(String.format(
                        "Contract '%s' primary key column '%s' is not declared. Declared columns: %s", name, key, names));
            }
        }

        Map<String, String> fks = new LinkedHashMap<>();
        if (foreignKeys != null) {
            foreignKeys.forEach((column, target) -> {
                if (!names.contains(column)) {
                    throw new MalformedContractException(String.format(
                            "Contract '%s' foreign key column '%s' is not declared", name, column));
                }
                if (target == null || !target.matches("[^.\\s]+\\.[^.\\s]+")) {
                    throw new MalformedContractException(String.format(
                            "Contract '%s' foreign key '%s' must reference 'table.column', got '%s'", name, column, target));
                }
                fks.put(column, target);
            });
        }
        foreignKeys = Collections.unmodifiableMap(fks);

        description = description != null ? description : "";
        owner = owner != null ? owner : "";
        compatibilityMode = compatibilityMode != null ? compatibilityMode : CompatibilityMode.BACKWARD;
        createdAt = createdAt != null ? createdAt : Instant.now();
        updatedAt = updatedAt != null ? updatedAt : createdAt;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new MalformedContractException("Contract " + field + " cannot be null or blank");
        }
    }

    public Optional<ColumnContract> column(String columnName) {
        return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
    }

    @JsonIgnore
    public List<String> getColumnNames() {
        return columns.stream().map(ColumnContract::name).toList();
    }

    /**
     * First 8 hex characters of the MD5 of the {@code [name, dtype, nullable]} triples sorted by name.
     * Changes whenever a column is added, removed, retyped or its nullability flips.
     */
    @JsonIgnore
    public String getSchemaHash() {
        List<List<Object>> triples = new ArrayList<>(columns.size());
        columns.stream()
                .sorted(Comparator.comparing(ColumnContract::name))
                .forEach(c -> triples.add(List.of(c.name(), c.dtype().getTag(), c.nullable())));
        try {
            byte[] json = HASH_MAPPER.writeValueAsString(triples).getBytes(StandardCharsets.UTF_8);
            return DigestUtils.md5DigestAsHex(json).substring(0, 8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize schema of contract '" + name + "'", e);
        }
    }

    @Override
    public String toString() {
        return "DataContract{" + name + " v" + version + ", domain=" + domain + ", columns=" + columns.size() + "}";
    }
}
