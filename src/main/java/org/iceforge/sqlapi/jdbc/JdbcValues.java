package org.iceforge.sqlapi.jdbc;

import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts JDBC values into plain Java values the encoders know how to write:
 * String, Number, Boolean, List and null.
 */
final class JdbcValues {
    private JdbcValues() {}

    static TabularResult read(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int n = md.getColumnCount();
        String[] labels = new String[n];
        Set<String> columns = new LinkedHashSet<>();
        for (int i = 1; i <= n; i++) {
            labels[i - 1] = md.getColumnLabel(i);
            columns.add(labels[i - 1]);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= n; i++) {
                // remove first so a duplicated label takes the position of its last occurrence
                row.remove(labels[i - 1]);
                row.put(labels[i - 1], normalize(rs.getObject(i)));
            }
            rows.add(row);
        }
        return new TabularResult(List.copyOf(columns), rows, rows.size());
    }

    static Object normalize(Object v) throws SQLException {
        if (v == null) return null;
        if (v instanceof String || v instanceof Number || v instanceof Boolean) return v;
        if (v instanceof Array a) {
            Object arr = a.getArray();
            List<Object> out = new ArrayList<>();
            if (arr instanceof Object[] objects) {
                for (Object o : objects) out.add(normalize(o));
            } else if (arr != null) {
                int len = java.lang.reflect.Array.getLength(arr);
                for (int i = 0; i < len; i++) out.add(normalize(java.lang.reflect.Array.get(arr, i)));
            }
            return out;
        }
        if (v instanceof Object[] objects) {
            List<Object> out = new ArrayList<>(objects.length);
            for (Object o : objects) out.add(normalize(o));
            return out;
        }
        if (v instanceof Timestamp ts) return ts.toInstant().toString();
        if (v instanceof Date d) return d.toLocalDate().toString();
        if (v instanceof Time t) return t.toLocalTime().toString();
        if (v instanceof TemporalAccessor) return v.toString();
        if (v instanceof byte[] bytes) return Base64.getEncoder().encodeToString(bytes);
        if (v instanceof Clob c) return c.getSubString(1, (int) c.length());
        if (v instanceof Blob b) return Base64.getEncoder().encodeToString(b.getBytes(1, (int) b.length()));
        // PGobject (geometry, json, ...) and driver specific types
        return v.toString();
    }
}
