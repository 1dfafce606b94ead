package com.di.trialguard.contract;

import com.di.trialguard.dataset.ColumnType;
import com.di.trialguard.dataset.Dataset;
import com.di.trialguard.dataset.Values;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.DoublePredicate;

/**
 * Evaluates datasets against data contracts: schema drift detection, value-level clause checks and the
 * resulting accept / alert / quarantine action.
 *
 * <p>Stateless apart from its threshold and clock; safe to share across threads. Schema drift and value
 * violations are outcomes in the returned result, never exceptions.
 */
@Slf4j
public class ContractEngine {

    public static final double DEFAULT_QUARANTINE_THRESHOLD = 0.05;

    private final double quarantineThreshold;
    private final Clock clock;

    public ContractEngine() {
        this(DEFAULT_QUARANTINE_THRESHOLD, Clock.systemUTC());
    }

    /**
     * @param quarantineThreshold failed-record ratio above which data is quarantined (exclusive)
     */
    public ContractEngine(double quarantineThreshold, Clock clock) {
        if (quarantineThreshold < 0 || quarantineThreshold > 1 || Double.isNaN(quarantineThreshold)) {
            throw new IllegalArgumentException("quarantineThreshold must be within [0, 1], got " + quarantineThreshold);
        }
        this.quarantineThreshold = quarantineThreshold;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public double getQuarantineThreshold() {
        return quarantineThreshold;
    }

    /**
     * Compares the dataset's columns and observed types with the contract. Added columns are reported in
     * dataset order, then removed and retyped columns in contract order.
     */
    public List<SchemaChange> detectSchemaChanges(Dataset dataset, DataContract contract) {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(contract, "contract");
        CompatibilityMode mode = contract.compatibilityMode();
        Set<String> declared = new HashSet<>(contract.getColumnNames());
        List<SchemaChange> changes = new ArrayList<>();

        for (String column : dataset.columnNames()) {
            if (!declared.contains(column)) {
                changes.add(SchemaChange.builder()
                        .changeType(ChangeType.COLUMN_ADDED)
                        .columnName(column)
                        .newValue(dataset.type(column).getTag())
                        .breaking(mode.addedColumnBreaks())
                        .description("New column '" + column + "' detected in incoming data")
                        .build());
            }
        }

        for (ColumnContract column : contract.columns()) {
            if (!dataset.hasColumn(column.name())) {
                changes.add(SchemaChange.builder()
                        .changeType(ChangeType.COLUMN_REMOVED)
                        .columnName(column.name())
                        .oldValue(column.dtype().getTag())
                        .breaking(mode.removedColumnBreaks())
                        .description("Required column '" + column.name() + "' missing from incoming data")
                        .build());
            }
        }

        for (ColumnContract column : contract.columns()) {
            if (!dataset.hasColumn(column.name())) {
                continue;
            }
            ColumnType observed = dataset.type(column.name());
            if (!typesCompatible(column.dtype(), observed)) {
                changes.add(SchemaChange.builder()
                        .changeType(ChangeType.TYPE_CHANGED)
                        .columnName(column.name())
                        .oldValue(column.dtype().getTag())
                        .newValue(observed.getTag())
                        .breaking(true)
                        .description(String.format("Column '%s' type changed from %s to %s",
                                column.name(), column.dtype(), observed))
                        .build());
            }
        }
        return changes;
    }

    /**
     * Exact match, or one of the two whitelisted safe upcasts: integers into a float column and
     * string-like values into a string column. Kept deliberately narrow; widening it changes audit results.
     */
    static boolean typesCompatible(ColumnType declared, ColumnType observed) {
        if (declared == observed) {
            return true;
        }
        if (declared == ColumnType.FLOAT64 && observed == ColumnType.INT64) {
            return true;
        }
        return declared == ColumnType.STRING && isStringLike(observed);
    }

    private static boolean isStringLike(ColumnType observed) {
        return observed == ColumnType.STRING;
    }

    /**
     * Runs the value clauses of every declared column present in the dataset, in the fixed order
     * not-null, unique, allowed values, min, max. Columns absent from the dataset are skipped here; they
     * surface as schema changes instead.
     */
    public Map<String, ColumnValidation> validateValues(Dataset dataset, DataContract contract) {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(contract, "contract");
        Map<String, ColumnValidation> results = new LinkedHashMap<>();

        for (ColumnContract column : contract.columns()) {
            if (!dataset.hasColumn(column.name())) {
                continue;
            }
            List<Object> values = dataset.column(column.name());
            List<ColumnCheckResult> checks = new ArrayList<>();

            if (!column.nullable()) {
                long nulls = values.stream().filter(Values::isNull).count();
                checks.add(check(ContractCheck.NOT_NULL, nulls).build());
            }
            if (column.unique()) {
                checks.add(check(ContractCheck.UNIQUE, countDuplicates(values)).build());
            }
            if (column.hasAllowedValues()) {
                Set<String> allowed = new HashSet<>(column.allowedValues());
                long invalid = values.stream()
                        .filter(v -> !Values.isNull(v))
                        .filter(v -> !allowed.contains(String.valueOf(v)))
                        .count();
                checks.add(check(ContractCheck.ALLOWED_VALUES, invalid).allowed(column.allowedValues()).build());
            }
            if (column.minValue() != null) {
                double min = column.minValue();
                long below = countOutOfBound(values, number -> number < min);
                checks.add(check(ContractCheck.MIN_VALUE, below).min(min).build());
            }
            if (column.maxValue() != null) {
                double max = column.maxValue();
                long above = countOutOfBound(values, number -> number > max);
                checks.add(check(ContractCheck.MAX_VALUE, above).max(max).build());
            }
            results.put(column.name(), ColumnValidation.of(column.name(), checks));
        }
        return results;
    }

    private static ColumnCheckResult.ColumnCheckResultBuilder check(ContractCheck check, long failed) {
        return ColumnCheckResult.builder().check(check).passed(failed == 0).failedCount(failed);
    }

    /** Occurrences beyond the first of each value; nulls are equal to each other. */
    private static long countDuplicates(List<Object> values) {
        Set<Object> seen = new HashSet<>();
        boolean nullSeen = false;
        long duplicates = 0;
        for (Object value : values) {
            if (Values.isNull(value)) {
                if (nullSeen) {
                    duplicates++;
                }
                nullSeen = true;
            } else if (!seen.add(value)) {
                duplicates++;
            }
        }
        return duplicates;
    }

    /** Nulls are skipped; a non-numeric value cannot satisfy a numeric bound and counts as failed. */
    private static long countOutOfBound(List<Object> values, DoublePredicate outOfBound) {
        long failed = 0;
        for (Object value : values) {
            if (Values.isNull(value)) {
                continue;
            }
            Double number = numericOrNull(value);
            if (number == null || outOfBound.test(number)) {
                failed++;
            }
        }
        return failed;
    }

    private static Double numericOrNull(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Full evaluation. The action is decided in strict order: any breaking change quarantines; a
     * failed-record ratio above the threshold quarantines; any failed record alerts; any non-breaking
     * change alerts; otherwise accept.
     */
    public ContractValidationResult validateAgainstContract(Dataset dataset, DataContract contract) {
        List<SchemaChange> changes = detectSchemaChanges(dataset, contract);
        boolean hasBreaking = changes.stream().anyMatch(SchemaChange::breaking);
        Map<String, ColumnValidation> valueValidation = validateValues(dataset, contract);
        long failedRecords = valueValidation.values().stream().mapToLong(ColumnValidation::failedCount).sum();
        long totalRecords = dataset.size();

        ContractAction action = decideAction(hasBreaking, failedRecords, totalRecords, !changes.isEmpty());

        log.info("[CONTRACT] contract={} v{} records={} failed={} changes={} breaking={} action={}",
                contract.name(), contract.version(), totalRecords, failedRecords, changes.size(), hasBreaking, action);

        return ContractValidationResult.builder()
                .contractName(contract.name())
                .contractVersion(contract.version())
                .contractDomain(contract.domain())
                .schemaHash(contract.getSchemaHash())
                .timestamp(Instant.now(clock))
                .schemaChanges(changes)
                .hasBreakingChanges(hasBreaking)
                .valueValidation(valueValidation)
                .totalRecords(totalRecords)
                .failedRecords(failedRecords)
                .valid(action.isValid())
                .action(action)
                .build();
    }

    ContractAction decideAction(boolean hasBreaking, long failedRecords, long totalRecords, boolean hasChanges) {
        if (hasBreaking) {
            return ContractAction.QUARANTINE;
        }
        double failedRatio = totalRecords == 0 ? 0.0 : (double) failedRecords / totalRecords;
        if (failedRatio > quarantineThreshold) {
            return ContractAction.QUARANTINE;
        }
        if (failedRecords > 0 || hasChanges) {
            return ContractAction.ALERT;
        }
        return ContractAction.ACCEPT;
    }
}
