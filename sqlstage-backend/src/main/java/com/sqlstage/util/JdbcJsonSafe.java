package com.sqlstage.util;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.time.OffsetDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * Converts JDBC column values into values that survive a JSON round trip through the result cache.
 *
 * <p>Numbers, booleans and strings pass through. Date/time values become their ISO text, binary
 * values become base64, arrays become lists, and Postgres {@code PGobject} values (json, jsonb,
 * interval, inet and other custom types) become their text form.
 */
public final class JdbcJsonSafe {
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_ARRAY_DEPTH = 3;
    private static final String PG_OBJECT_CLASS = "org.postgresql.util.PGobject";

    private JdbcJsonSafe() {
    }

    /**
     * Reads a column value and returns a JSON-safe equivalent.
     *
     * <p>Zoned timestamps are read as {@link OffsetDateTime} so the offset survives; the default
     * {@code Timestamp} mapping would drop it.
     *
     * @param rs result set positioned on a row
     * @param columnIndex 1-based column index
     * @param typeName database type name of the column, may be null
     * @return json-safe value
     * @throws SQLException on JDBC errors
     */
    public static Object read(ResultSet rs, int columnIndex, String typeName) throws SQLException {
        if (isZonedTimestamp(typeName)) {
            OffsetDateTime value = rs.getObject(columnIndex, OffsetDateTime.class);
            return value != null ? value.toString() : null;
        }
        return toJsonSafe(rs.getObject(columnIndex), 0);
    }

    static boolean isZonedTimestamp(String typeName) {
        return typeName != null
                && ("timestamptz".equalsIgnoreCase(typeName) || "timestamp with time zone".equalsIgnoreCase(typeName));
    }

    static Object toJsonSafe(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }

        if (v instanceof BigDecimal || v instanceof BigInteger) {
            // Precision beyond double would be lost by JSON number parsing on the way back
            return v.toString();
        }
        if (v instanceof Number || v instanceof Boolean || v instanceof String) {
            return v;
        }
        if (v instanceof Character) {
            return v.toString();
        }
        if (v instanceof java.sql.Timestamp ts) {
            return ts.toLocalDateTime().toString();
        }
        if (v instanceof java.sql.Date || v instanceof java.sql.Time || v instanceof TemporalAccessor) {
            return v.toString();
        }
        if (v instanceof UUID) {
            return v.toString();
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            return readBlobBase64(blob);
        }
        if (v instanceof SQLXML xml) {
            return xml.getString();
        }
        if (v instanceof Array arr) {
            return readArray(arr.getArray(), depth);
        }
        if (v instanceof Object[] objects) {
            return readArray(objects, depth);
        }
        if (PG_OBJECT_CLASS.equals(v.getClass().getName())) {
            return readPgObject(v);
        }

        return String.valueOf(v);
    }

    private static Object readArray(Object arrayValue, int depth) throws SQLException {
        if (!(arrayValue instanceof Object[] elements)) {
            return String.valueOf(arrayValue);
        }
        if (depth >= MAX_ARRAY_DEPTH) {
            return String.valueOf(List.of(elements));
        }
        List<Object> out = new ArrayList<>(elements.length);
        for (Object elem : elements) {
            out.add(toJsonSafe(elem, depth + 1));
        }
        return out;
    }

    private static String readPgObject(Object pgObject) {
        try {
            Object value = pgObject.getClass().getMethod("getValue").invoke(pgObject);
            return value != null ? value.toString() : null;
        } catch (ReflectiveOperationException e) {
            return pgObject.toString();
        }
    }

    private static String readClob(Clob clob) throws SQLException {
        long length = clob.length();
        if (length <= 0) {
            return "";
        }
        try (Reader reader = clob.getCharacterStream()) {
            char[] buf = new char[8192];
            StringBuilder sb = new StringBuilder();
            int n;
            while (sb.length() < MAX_LOB_CHARS
                    && (n = reader.read(buf, 0, Math.min(buf.length, MAX_LOB_CHARS - sb.length()))) > 0) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        } catch (IOException e) {
            throw new SQLException("Failed to read CLOB value", e);
        }
    }

    private static String readBlobBase64(Blob blob) throws SQLException {
        int toRead = (int) Math.min(blob.length(), MAX_BLOB_BYTES);
        if (toRead <= 0) {
            return "";
        }
        return Base64.getEncoder().encodeToString(blob.getBytes(1, toRead));
    }
}
