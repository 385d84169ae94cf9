package com.company.signalanalytics.util;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;

/**
 * Lenient conversions for values read back from the warehouse, where
 * numbers may arrive as BigDecimal, Long or Double depending on the driver.
 */
public final class RowValues {

    private RowValues() {
    }

    public static Long asLong(Object value) {
        if (value == null) return null;
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.valueOf(value.toString().trim());
    }

    public static Double asDouble(Object value) {
        if (value == null) return null;
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.valueOf(value.toString().trim());
    }

    public static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    public static Boolean asBoolean(Object value) {
        if (value == null) return null;
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        return Boolean.valueOf(value.toString().trim());
    }

    public static LocalDateTime asLocalDateTime(Object value) {
        if (value == null) return null;
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        return LocalDateTime.parse(value.toString().trim().replace(' ', 'T'));
    }

    /**
     * Key used to match rows from different result sets: numbers compare
     * equal whatever their Java type (12, 12L and 12.00 give "12"), anything
     * else by its string form.
     */
    public static String joinKey(Object value) {
        if (value == null) return null;
        if (value instanceof Number && Double.isFinite(((Number) value).doubleValue())) {
            BigDecimal decimal = new BigDecimal(value.toString()).stripTrailingZeros();
            return decimal.scale() <= 0 ? decimal.toBigInteger().toString() : decimal.toPlainString();
        }
        return value.toString();
    }
}
