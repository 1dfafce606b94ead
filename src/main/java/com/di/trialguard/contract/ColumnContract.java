package com.di.trialguard.contract;

import com.di.trialguard.dataset.ColumnType;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Contract of a single column. Absent {@code nullable} means nullable; an empty allow-list means
 * unconstrained. The optional {@code pattern} is compiled when the contract is built so a bad expression
 * fails at load time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnContract(
        @JsonProperty("name") String name,
        @JsonProperty("dtype") ColumnType dtype,
        @JsonProperty("nullable") boolean nullable,
        @JsonProperty("unique") boolean unique,
        @JsonProperty("allowed_values") List<String> allowedValues,
        @JsonProperty("min_value") Double minValue,
        @JsonProperty("max_value") Double maxValue,
        @JsonProperty("pattern") String pattern,
        @JsonProperty("description") String description) {

    public ColumnContract {
        if (name == null || name.isBlank()) {
            throw new MalformedContractException("Column name cannot be null or blank");
        }
        if (dtype == null) {
            throw new MalformedContractException("Column '" + name + "' has no dtype");
        }
        if (minValue != null && maxValue != null && minValue > maxValue) {
            throw new MalformedContractException(String.format(
                    "Column '%s' has min_value %s greater than max_value %s", name, minValue, maxValue));
        }
        if (pattern != null) {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                throw new MalformedContractException(
                        "Column '" + name + "' has an invalid pattern '" + pattern + "': " + e.getDescription(), e);
            }
        }
        allowedValues = allowedValues != null ? List.copyOf(allowedValues) : List.of();
        description = description != null ? description : "";
    }

    @JsonCreator
    @Builder
    static ColumnContract create(@JsonProperty("name") String name,
                                 @JsonProperty("dtype") ColumnType dtype,
                                 @JsonProperty("nullable") Boolean nullable,
                                 @JsonProperty("unique") Boolean unique,
                                 @JsonProperty("allowed_values") List<String> allowedValues,
                                 @JsonProperty("min_value") Double minValue,
                                 @JsonProperty("max_value") Double maxValue,
                                 @JsonProperty("pattern") String pattern,
                                 @JsonProperty("description") String description) {
        return new ColumnContract(name, dtype,
                nullable == null || nullable,
                unique != null && unique,
                allowedValues, minValue, maxValue, pattern, description);
    }

    public boolean hasAllowedValues() {
        return !allowedValues.isEmpty();
    }
}
