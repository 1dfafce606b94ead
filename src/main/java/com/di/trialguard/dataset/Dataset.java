package com.di.trialguard.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Immutable, fully materialised tabular dataset: ordered column names, one {@link ColumnType} per column
 * and a fixed list of rows. Rows are exposed as unmodifiable name → value maps; a missing value is {@code null}.
 *
 * <p>Instances are safe to share across threads. Engines never mutate a dataset; subsets are produced with
 * {@link #filter(Predicate)}.
 */
public final class Dataset {

    private final List<String> columnNames;
    private final Map<String, ColumnType> columnTypes;
    private final List<Map<String, Object>> rows;

    private Dataset(List<String> columnNames, Map<String, ColumnType> columnTypes, List<Map<String, Object>> rows) {
        this.columnNames = columnNames;
        this.columnTypes = columnTypes;
        this.rows = rows;
    }

    /**
     * Builds a dataset from row maps. Column order is first-seen key order across rows.
     */
    public static Dataset fromRows(List<Map<String, Object>> rows) {
        return fromRows(null, rows, null);
    }

    /**
     * Builds a dataset from row maps.
     *
     * @param columns       explicit column order; {@code null} or empty derives it from the rows
     * @param rows          row maps (keys outside {@code columns} are dropped)
     * @param explicitTypes declared types that win over inference; may be {@code null}
     */
    public static Dataset fromRows(List<String> columns,
                                   List<Map<String, Object>> rows,
                                   Map<String, ColumnType> explicitTypes) {
        List<Map<String, Object>> source = rows != null ? rows : List.of();
        List<String> names = columns != null && !columns.isEmpty()
                ? List.copyOf(new LinkedHashSet<>(columns))
                : deriveColumns(source);

        List<Map<String, Object>> copied = new ArrayList<>(source.size());
        for (Map<String, Object> row : source) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (String name : names) {
                copy.put(name, row != null ? row.get(name) : null);
            }
            copied.add(Collections.unmodifiableMap(copy));
        }

        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (String name : names) {
            ColumnType declared = explicitTypes != null ? explicitTypes.get(name) : null;
            types.put(name, declared != null ? declared : inferType(name, copied));
        }
        return new Dataset(names, Collections.unmodifiableMap(types), Collections.unmodifiableList(copied));
    }

    public static Builder builder(String... columns) {
        return new Builder(List.of(columns));
    }

    private static List<String> deriveColumns(List<Map<String, Object>> rows) {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            if (row != null) {
                names.addAll(row.keySet());
            }
        }
        return List.copyOf(names);
    }

    private static ColumnType inferType(String column, List<Map<String, Object>> rows) {
        ColumnType inferred = null;
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            if (Values.isNull(value)) {
                continue;
            }
            inferred = ColumnType.widen(inferred, ColumnType.of(value));
            if (inferred == ColumnType.STRING) {
                break;
            }
        }
        return inferred != null ? inferred : ColumnType.STRING;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<String> columnNames() {
        return columnNames;
    }

    public boolean hasColumn(String name) {
        return columnTypes.containsKey(name);
    }

    public Map<String, ColumnType> columnTypes() {
        return columnTypes;
    }

    /**
     * @throws IllegalArgumentException if the column does not exist
     */
    public ColumnType type(String name) {
        requireColumn(name);
        return columnTypes.get(name);
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public Map<String, Object> row(int index) {
        return rows.get(index);
    }

    /**
     * Values of one column in row order (nulls included).
     *
     * @throws IllegalArgumentException if the column does not exist
     */
    public List<Object> column(String name) {
        requireColumn(name);
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(name));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Rows matching the predicate, keeping this dataset's columns and types.
     */
    public Dataset filter(Predicate<Map<String, Object>> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        List<Map<String, Object>> kept = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (predicate.test(row)) {
                kept.add(row);
            }
        }
        return new Dataset(columnNames, columnTypes, Collections.unmodifiableList(kept));
    }

    /** Empty dataset with this dataset's columns and types. */
    public Dataset emptyCopy() {
        return new Dataset(columnNames, columnTypes, List.of());
    }

    private void requireColumn(String name) {
        if (!columnTypes.containsKey(name)) {
            throw new IllegalArgumentException("Unknown column '" + name + "'. Available columns: " + columnNames);
        }
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columnTypes + ", rows=" + rows.size() + "}";
    }

    /**
     * Positional builder, mainly for callers assembling small datasets in code.
     */
    public static final class Builder {

        private final List<String> columns;
        private final Map<String, ColumnType> types = new LinkedHashMap<>();
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = columns;
        }

        public Builder columnType(String column, ColumnType type) {
            types.put(column, type);
            return this;
        }

        public Builder row(Object... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row has %d values but dataset has %d columns %s", values.length, columns.size(), columns));
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < values.length; i++) {
                row.put(columns.get(i), values[i]);
            }
            rows.add(row);
            return this;
        }

        public Dataset build() {
            return Dataset.fromRows(columns, rows, types);
        }
    }
}
