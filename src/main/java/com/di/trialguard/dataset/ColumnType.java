package com.di.trialguard.dataset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;

/**
 * Logical column types shared by datasets and column contracts.
 * <p>Tags follow the contract vocabulary ({@code string}, {@code int64}, ...). Common aliases are accepted
 * by {@link #fromTag(String)} so that contracts written by hand or produced by other tools still parse.
 */
public enum ColumnType {

    STRING("string"),
    INT64("int64"),
    FLOAT64("float64"),
    DATETIME64("datetime64"),
    BOOLEAN("boolean");

    private static final Map<String, ColumnType> ALIASES = Map.ofEntries(
            Map.entry("object", STRING),
            Map.entry("str", STRING),
            Map.entry("varchar", STRING),
            Map.entry("text", STRING),
            Map.entry("int", INT64),
            Map.entry("integer", INT64),
            Map.entry("long", INT64),
            Map.entry("bigint", INT64),
            Map.entry("float", FLOAT64),
            Map.entry("double", FLOAT64),
            Map.entry("decimal", FLOAT64),
            Map.entry("datetime", DATETIME64),
            Map.entry("date", DATETIME64),
            Map.entry("timestamp", DATETIME64),
            Map.entry("bool", BOOLEAN)
    );

    private final String tag;

    ColumnType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /**
     * Parses a type tag or alias (case-insensitive).
     *
     * @throws IllegalArgumentException if the tag is blank or not recognised
     */
    @JsonCreator
    public static ColumnType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Column type cannot be null or blank");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (ColumnType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        ColumnType alias = ALIASES.get(normalized);
        if (alias == null) {
            throw new IllegalArgumentException("Unknown column type: '" + tag + "'");
        }
        return alias;
    }

    /** Type of a single non-null value, or {@code null} for a null value. */
    public static ColumnType of(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return INT64;
        }
        if (value instanceof Number) {
            return FLOAT64;
        }
        if (value instanceof LocalDate || value instanceof LocalDateTime || value instanceof Instant
                || value instanceof OffsetDateTime || value instanceof ZonedDateTime) {
            return DATETIME64;
        }
        return STRING;
    }

    /**
     * Widens two observed types into the type of a column holding both.
     * Integral and fractional numbers widen to {@link #FLOAT64}; any other mix is {@link #STRING}.
     */
    public static ColumnType widen(ColumnType current, ColumnType next) {
        if (current == null) {
            return next;
        }
        if (next == null || current == next) {
            return current;
        }
        if ((current == INT64 && next == FLOAT64) || (current == FLOAT64 && next == INT64)) {
            return FLOAT64;
        }
        return STRING;
    }

    @Override
    public String toString() {
        return tag;
    }
}
