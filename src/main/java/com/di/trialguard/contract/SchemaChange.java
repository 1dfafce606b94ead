package com.di.trialguard.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Objects;

/**
 * One detected difference between a contract and incoming data. Old and new values are type tags
 * ({@code null} on the side where the column does not exist).
 */
@Builder
public record SchemaChange(
        @JsonProperty("change_type") ChangeType changeType,
        @JsonProperty("column_name") String columnName,
        @JsonProperty("old_value") String oldValue,
        @JsonProperty("new_value") String newValue,
        @JsonProperty("is_breaking") boolean breaking,
        @JsonProperty("description") String description) {

    public SchemaChange {
        Objects.requireNonNull(changeType, "changeType");
        Objects.requireNonNull(columnName, "columnName");
    }
}
