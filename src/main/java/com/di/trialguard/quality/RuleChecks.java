package com.di.trialguard.quality;

import com.di.trialguard.dataset.Dataset;
import com.di.trialguard.dataset.Values;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reusable {@link RuleCheck} building blocks used by the pre-built rule sets.
 *
 * <p>Every check reads its columns through {@link Dataset#column(String)} or {@link Dataset#type(String)}
 * first, so a missing column raises and the engine records the rule as an ERROR result.
 */
public final class RuleChecks {

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd", Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private RuleChecks() {
    }

    /** Rows where the column is null. */
    public static RuleCheck notNull(String column) {
        return dataset -> {
            dataset.type(column);
            return RuleOutcome.ofFailures(dataset.filter(row -> Values.isNull(row.get(column))));
        };
    }

    /**
     * Every row whose value appears more than once. Nulls compare equal to each other, so several null
     * values are reported as duplicates too.
     */
    public static RuleCheck unique(String column) {
        return dataset -> {
            Map<Object, Integer> counts = new HashMap<>();
            for (Object value : dataset.column(column)) {
                counts.merge(key(value), 1, Integer::sum);
            }
            return RuleOutcome.ofFailures(dataset.filter(row -> counts.get(key(row.get(column))) > 1));
        };
    }

    /** Rows whose numeric value lies outside {@code [min, max]}. Null values are not checked. */
    public static RuleCheck between(String column, double min, double max) {
        return dataset -> {
            dataset.type(column);
            return RuleOutcome.ofFailures(dataset.filter(row -> {
                Object value = row.get(column);
                if (Values.isNull(value)) {
                    return false;
                }
                double number = Values.toDouble(value);
                return number < min || number > max;
            }));
        };
    }

    /** Rows whose numeric value is negative. Null values are not checked. */
    public static RuleCheck nonNegative(String column) {
        return between(column, 0.0, Double.POSITIVE_INFINITY);
    }

    /**
     * Controlled vocabulary: the upper-cased value must be one of {@code allowed}.
     *
     * @param nullsFail whether a null value counts as outside the vocabulary
     */
    public static RuleCheck inVocabulary(String column, Set<String> allowed, boolean nullsFail) {
        Set<String> normalized = allowed.stream()
                .map(v -> v.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        return dataset -> {
            dataset.type(column);
            return RuleOutcome.ofFailures(dataset.filter(row -> {
                String value = Values.upper(row.get(column));
                if (value == null) {
                    return nullsFail;
                }
                return !normalized.contains(value);
            }));
        };
    }

    /**
     * The first ten characters must parse as an ISO-8601 calendar date ({@code YYYY-MM-DD}).
     * Null and unparsable values fail; they never raise.
     */
    public static RuleCheck isoDate(String column) {
        return dataset -> {
            dataset.type(column);
            return RuleOutcome.ofFailures(dataset.filter(row -> !isIsoDate(row.get(column))));
        };
    }

    /**
     * Rows where {@code end} sorts before {@code start}. Rows missing either value are excluded from this
     * rule: incomplete pairs are neither passed nor failed by it.
     */
    public static RuleCheck notBefore(String startColumn, String endColumn) {
        return dataset -> {
            dataset.type(startColumn);
            dataset.type(endColumn);
            return RuleOutcome.ofFailures(dataset.filter(row -> {
                Object start = row.get(startColumn);
                Object end = row.get(endColumn);
                if (Values.isNull(start) || Values.isNull(end)) {
                    return false;
                }
                return Values.compare(end, start) < 0;
            }));
        };
    }

    /**
     * Rows where {@code low >= high}. Rows missing either value are excluded.
     */
    public static RuleCheck strictlyLess(String lowColumn, String highColumn) {
        return dataset -> {
            dataset.type(lowColumn);
            dataset.type(highColumn);
            return RuleOutcome.ofFailures(dataset.filter(row -> {
                Object low = row.get(lowColumn);
                Object high = row.get(highColumn);
                if (Values.isNull(low) || Values.isNull(high)) {
                    return false;
                }
                return Values.toDouble(low) >= Values.toDouble(high);
            }));
        };
    }

    /**
     * Range keyed by a code column, e.g. a heart-rate range for rows whose test code is {@code HR}.
     * Rows whose code has no range, or whose value is null, are not checked.
     */
    public static RuleCheck rangeByCode(String codeColumn, String valueColumn, Map<String, Range> ranges) {
        Map<String, Range> copy = Map.copyOf(ranges);
        return dataset -> {
            dataset.type(codeColumn);
            dataset.type(valueColumn);
            return RuleOutcome.ofFailures(dataset.filter(row -> {
                Object code = row.get(codeColumn);
                Object value = row.get(valueColumn);
                if (Values.isNull(code) || Values.isNull(value)) {
                    return false;
                }
                Range range = copy.get(String.valueOf(code));
                return range != null && !range.contains(Values.toDouble(value));
            }));
        };
    }

    static boolean isIsoDate(Object value) {
        if (Values.isNull(value)) {
            return false;
        }
        if (value instanceof LocalDate) {
            return true;
        }
        String text = String.valueOf(value);
        if (text.length() < 10) {
            return false;
        }
        try {
            LocalDate.parse(text.substring(0, 10), ISO_DATE);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static Object key(Object value) {
        return Values.isNull(value) ? NullKey.INSTANCE : value;
    }

    private enum NullKey { INSTANCE }

    /**
     * Inclusive numeric range.
     */
    public record Range(double min, double max) {

        public Range {
            if (min > max) {
                throw new IllegalArgumentException("Range min " + min + " is greater than max " + max);
            }
        }

        public boolean contains(double value) {
            return value >= min && value <= max;
        }
    }
}
