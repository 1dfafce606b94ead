package com.di.trialguard.dataset;

import java.util.Locale;

/**
 * Null handling, numeric coercion and ordering for cell values.
 */
public final class Values {

    private Values() {
    }

    /** A cell is null when it is {@code null} or a floating-point NaN. */
    public static boolean isNull(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        return false;
    }

    /**
     * Numeric value of a non-null cell. Numeric strings are parsed.
     *
     * @throws IllegalArgumentException if the value is not numeric
     */
    public static double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Value '" + text + "' is not numeric", e);
            }
        }
        throw new IllegalArgumentException("Value '" + value + "' of type "
                + (value == null ? "null" : value.getClass().getSimpleName()) + " is not numeric");
    }

    /** Upper-cased string form, or {@code null} for a null cell. */
    public static String upper(Object value) {
        return isNull(value) ? null : String.valueOf(value).toUpperCase(Locale.ROOT);
    }

    /**
     * Orders two non-null cells: numbers numerically, everything else by natural order when both values
     * share a comparable type, and by string form otherwise (ISO-8601 dates order correctly as strings).
     */
    @SuppressWarnings("unchecked")
    public static int compare(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left instanceof Comparable && left.getClass().equals(right.getClass())) {
            return ((Comparable<Object>) left).compareTo(right);
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }
}
