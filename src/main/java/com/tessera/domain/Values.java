package com.tessera.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.Comparator;
import java.util.Date;
import java.util.Map;

/**
 * Value comparison shared by local filtering, sorting and result reordering.
 *
 * Numbers compare numerically, temporal values chronologically, everything else
 * by its string form. Times of day only compare chronologically with each other.
 */
public final class Values {

    /**
     * Orders non-null values; null handling is left to the caller
     */
    public static final Comparator<Object> NATURAL = Values::compare;

    private Values() {
    }

    public static int compare(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return toBigDecimal((Number) left).compareTo(toBigDecimal((Number) right));
        }
        BigDecimal leftNumber = asNumber(left, right);
        BigDecimal rightNumber = asNumber(right, left);
        if (leftNumber != null && rightNumber != null) {
            return leftNumber.compareTo(rightNumber);
        }
        if (isTimeOfDay(left) || isTimeOfDay(right)) {
            if (isTimeOfDay(left) && isTimeOfDay(right)) {
                return toLocalTime(left).compareTo(toLocalTime(right));
            }
        } else if (isTemporal(left) && isTemporal(right)) {
            return toInstant(left).compareTo(toInstant(right));
        }
        if (left instanceof Boolean && right instanceof Boolean) {
            return Boolean.compare((Boolean) left, (Boolean) right);
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }

    /**
     * SQL-style equality: numbers compare by value, so {@code 100} equals {@code 100.0}
     */
    public static boolean equal(Object left, Object right) {
        if (left == null || right == null) {
            return false;
        }
        if (asNumber(left, right) != null && asNumber(right, left) != null) {
            return compare(left, right) == 0;
        }
        if (isTemporal(left) && isTemporal(right) && isTimeOfDay(left) == isTimeOfDay(right)) {
            return compare(left, right) == 0;
        }
        if (left instanceof Number || right instanceof Number
            || left instanceof Boolean || right instanceof Boolean) {
            return String.valueOf(left).equals(String.valueOf(right));
        }
        return left.equals(right) || String.valueOf(left).equals(String.valueOf(right));
    }

    /**
     * Comparator over one row column: nulls first when ascending, last when descending
     */
    public static Comparator<Map<String, Object>> byColumn(String column, boolean ascending) {
        Comparator<Object> values = ascending
            ? Comparator.nullsFirst(NATURAL)
            : Comparator.nullsLast(NATURAL.reversed());
        return Comparator.comparing(row -> row.get(column), values);
    }

    public static boolean isTemporal(Object value) {
        return value instanceof Date || value instanceof TemporalAccessor;
    }

    public static boolean isTimeOfDay(Object value) {
        return value instanceof LocalTime || value instanceof OffsetTime || value instanceof java.sql.Time;
    }

    /**
     * Numeric view of a value compared against a number: numbers as-is, numeric strings parsed
     */
    private static BigDecimal asNumber(Object value, Object other) {
        if (value instanceof Number) {
            return toBigDecimal((Number) value);
        }
        if (value instanceof String && other instanceof Number) {
            try {
                return new BigDecimal(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return d > 0 ? BigDecimal.valueOf(Double.MAX_VALUE) : BigDecimal.valueOf(-Double.MAX_VALUE);
            }
            return BigDecimal.valueOf(d);
        }
        return new BigDecimal(number.toString());
    }

    private static LocalTime toLocalTime(Object value) {
        if (value instanceof java.sql.Time) {
            return ((java.sql.Time) value).toLocalTime();
        }
        if (value instanceof OffsetTime) {
            return ((OffsetTime) value).withOffsetSameInstant(ZoneOffset.UTC).toLocalTime();
        }
        return (LocalTime) value;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        throw new IllegalArgumentException("Unsupported temporal value: " + value.getClass().getName());
    }
}
