package io.cronrelay.storage;

import io.cronrelay.util.Timestamps;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Typed reads over gateway rows.
 */
public final class Rows {
    private Rows() {
    }

    public static String string(Map<String, Object> row, String column) {
        Object v = row.get(column);
        return v == null ? null : v.toString();
    }

    public static Long nullableLong(Map<String, Object> row, String column) {
        Object v = row.get(column);
        if (v == null) {
            return null;
        }
        if (v instanceof Number n) {
            return n.longValue();
        }
        String s = v.toString().trim();
        return s.isEmpty() ? null : Long.parseLong(s);
    }

    public static long longValue(Map<String, Object> row, String column, long fallback) {
        Long v = nullableLong(row, column);
        return v == null ? fallback : v;
    }

    public static Integer nullableInt(Map<String, Object> row, String column) {
        Long v = nullableLong(row, column);
        return v == null ? null : Math.toIntExact(v);
    }

    public static int intValue(Map<String, Object> row, String column, int fallback) {
        Integer v = nullableInt(row, column);
        return v == null ? fallback : v;
    }

    public static boolean flag(Map<String, Object> row, String column) {
        Object v = row.get(column);
        if (v == null) {
            return false;
        }
        if (v instanceof Number n) {
            return n.intValue() != 0;
        }
        return Boolean.parseBoolean(v.toString()) || "1".equals(v.toString().trim());
    }

    public static LocalDateTime timestamp(Map<String, Object> row, String column) {
        return Timestamps.parse(string(row, column));
    }
}
