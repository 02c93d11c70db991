package com.warehouse.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.Array;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Converts JDBC column values into types Jackson writes without driver-specific serializers.
 *
 * <p>Numbers, booleans and strings pass through. Temporal values and UUIDs become their ISO/text
 * form, binary becomes Base64, PostgreSQL {@code json}/{@code jsonb} become Jackson trees, other
 * {@code PGobject} values (interval, inet, ...) become their text value and SQL arrays become lists.
 */
public final class JdbcValues {
    private static final int MAX_NESTED_DEPTH = 3;
    private static final String PG_OBJECT_CLASS = "org.postgresql.util.PGobject";
    private static final Set<String> JSON_TYPES = Set.of("json", "jsonb");
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private JdbcValues() {
    }

    /**
     * Read the current row into a map keyed by column label, preserving projection order.
     *
     * @param rs result set positioned on a row
     * @return row map
     * @throws SQLException on JDBC errors
     */
    public static Map<String, Object> readRow(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int columnCount = md.getColumnCount();
        Map<String, Object> row = new LinkedHashMap<>(columnCount * 2);
        for (int i = 1; i <= columnCount; i++) {
            row.put(md.getColumnLabel(i), toJsonSafe(rs.getObject(i)));
        }
        return row;
    }

    public static Object toJsonSafe(Object v) throws SQLException {
        return toJsonSafe(v, 0);
    }

    private static Object toJsonSafe(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (v instanceof Number || v instanceof Boolean || v instanceof String) {
            return v;
        }
        if (PG_OBJECT_CLASS.equals(v.getClass().getName())) {
            return readPgObjectValue(v);
        }
        if (v instanceof java.sql.Date || v instanceof java.sql.Time || v instanceof java.sql.Timestamp
                || v instanceof TemporalAccessor || v instanceof UUID) {
            return v.toString();
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof Clob clob) {
            long length = clob.length();
            return length > 0 ? clob.getSubString(1, (int) Math.min(length, Integer.MAX_VALUE)) : "";
        }
        if (v instanceof SQLXML xml) {
            return xml.getString();
        }
        if (v instanceof Array arr) {
            if (depth >= MAX_NESTED_DEPTH) {
                return String.valueOf(arr);
            }
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] elements) {
                List<Object> out = new ArrayList<>(elements.length);
                for (Object element : elements) {
                    out.add(toJsonSafe(element, depth + 1));
                }
                return out;
            }
            return String.valueOf(arrayValue);
        }
        return String.valueOf(v);
    }

    // The PostgreSQL driver is a runtime-only dependency, so PGobject is read reflectively.
    private static Object readPgObjectValue(Object v) throws SQLException {
        String type;
        String value;
        try {
            Object rawType = v.getClass().getMethod("getType").invoke(v);
            Object rawValue = v.getClass().getMethod("getValue").invoke(v);
            type = rawType != null ? rawType.toString() : null;
            value = rawValue != null ? rawValue.toString() : null;
        } catch (ReflectiveOperationException e) {
            throw new SQLException("Unable to read PostgreSQL object value of type " + v.getClass().getName(), e);
        }
        if (value != null && type != null && JSON_TYPES.contains(type)) {
            try {
                return OBJECT_MAPPER.readTree(value);
            } catch (JsonProcessingException e) {
                throw new SQLException("Invalid " + type + " value returned by the database", e);
            }
        }
        return value;
    }
}
