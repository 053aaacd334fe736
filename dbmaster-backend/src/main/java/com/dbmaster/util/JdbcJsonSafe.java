package com.dbmaster.util;

import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts JDBC values into JSON-safe primitives before they are stored in execution history,
 * sent in notifications or returned to API callers.
 *
 * <p>Date and time values come back as their string form so no implicit time zone conversion
 * happens between the server and the client.
 */
public final class JdbcJsonSafe {
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_STRING_CHARS = 100_000;
    private static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JdbcJsonSafe() {
    }

    /**
     * Reads every remaining row of the result set, keyed by column label in select order.
     *
     * @param rs result set positioned before the first row
     * @return rows
     * @throws SQLException on JDBC errors
     */
    public static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int columnCount = md.getColumnCount();
        List<String> labels = columnLabels(md);

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(labels.get(i - 1), readJsonSafeValue(rs, i));
            }
            rows.add(row);
        }
        return rows;
    }

    public static List<String> columnLabels(ResultSetMetaData md) throws SQLException {
        int columnCount = md.getColumnCount();
        List<String> labels = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            String label = md.getColumnLabel(i);
            labels.add(label != null && !label.isEmpty() ? label : md.getColumnName(i));
        }
        return labels;
    }

    /**
     * Reads a JDBC column value and returns a JSON-safe equivalent.
     *
     * @param rs result set
     * @param columnIndex 1-based column index
     * @return json-safe value
     */
    public static Object readJsonSafeValue(ResultSet rs, int columnIndex) {
        try {
            return toJsonSafe(rs.getObject(columnIndex));
        } catch (SQLException e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    /**
     * Converts an arbitrary JDBC object into a JSON-safe primitive.
     *
     * @param v value to convert
     * @return json-safe value
     */
    public static Object toJsonSafe(Object v) {
        if (v == null) {
            return null;
        }
        try {
            if (v instanceof Number || v instanceof Boolean) {
                return v;
            }
            if (v instanceof String s) {
                return truncateString(s);
            }
            if (v instanceof java.sql.Date || v instanceof java.sql.Time || v instanceof java.sql.Timestamp) {
                return v.toString();
            }
            if (v instanceof TemporalAccessor) {
                return v.toString();
            }
            if (v instanceof Clob clob) {
                return readClob(clob);
            }
            if (v instanceof Blob blob) {
                return readBlobBase64(blob);
            }
            if (v instanceof byte[] bytes) {
                return Base64.getEncoder().encodeToString(bytes);
            }
            return truncateString(String.valueOf(v));
        } catch (SQLException e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    private static String truncateString(String s) {
        if (s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }

    private static String readClob(Clob clob) throws SQLException {
        long length = clob.length();
        int toRead = (int) Math.min(length, MAX_LOB_CHARS);
        if (toRead <= 0) {
            return "";
        }
        try {
            return clob.getSubString(1, toRead);
        } catch (SQLException e) {
            try (Reader reader = clob.getCharacterStream()) {
                if (reader == null) {
                    return "";
                }
                char[] buf = new char[Math.min(MAX_LOB_CHARS, 8192)];
                StringBuilder sb = new StringBuilder();
                int n;
                while (sb.length() < MAX_LOB_CHARS && (n = reader.read(buf, 0, Math.min(buf.length, MAX_LOB_CHARS - sb.length()))) > 0) {
                    sb.append(buf, 0, n);
                }
                return sb.toString();
            } catch (java.io.IOException io) {
                return UNSUPPORTED_PLACEHOLDER;
            }
        }
    }

    private static String readBlobBase64(Blob blob) throws SQLException {
        long length = blob.length();
        int toRead = (int) Math.min(length, MAX_BLOB_BYTES);
        if (toRead <= 0) {
            return "";
        }
        return Base64.getEncoder().encodeToString(blob.getBytes(1, toRead));
    }
}
