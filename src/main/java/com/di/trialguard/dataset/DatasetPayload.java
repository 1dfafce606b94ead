package com.di.trialguard.dataset;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON form of a dataset in REST requests. {@code columns} and {@code column_types} are optional:
 * column order defaults to first-seen key order and types are inferred from the values.
 */
public record DatasetPayload(
        @JsonProperty("columns") List<String> columns,
        @JsonProperty("column_types") Map<String, ColumnType> columnTypes,
        @JsonProperty("rows") List<Map<String, Object>> rows) {

    public Dataset toDataset() {
        return Dataset.fromRows(columns, rows, columnTypes);
    }
}
