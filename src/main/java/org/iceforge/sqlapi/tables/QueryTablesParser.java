package org.iceforge.sqlapi.tables;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Parses the output of the table extraction function: either a PostgreSQL array literal
 * such as {@code {public.a,b}} or an already decoded SQL array.
 */
final class QueryTablesParser {
    private QueryTablesParser() {}

    static List<String> parse(Object value) {
        if (value == null) return List.of();
        if (value instanceof Collection<?> c) {
            List<String> out = new ArrayList<>(c.size());
            for (Object o : c) {
                if (o != null && !o.toString().isBlank()) out.add(o.toString());
            }
            return out;
        }
        return parseLiteral(value.toString());
    }

    static List<String> parseLiteral(String literal) {
        String s = literal.trim();
        if (s.length() < 2 || s.charAt(0) != '{' || s.charAt(s.length() - 1) != '}') {
            throw new IllegalArgumentException("Not an array literal: " + literal);
        }
        String inner = s.substring(1, s.length() - 1);
        if (inner.isBlank()) return List.of();

        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == '\\' && quoted && i + 1 < inner.length()) {
                cur.append(inner.charAt(++i));
            } else if (c == ',' && !quoted) {
                out.add(cur.toString());
                cur.setLength(0);
            } else {
                cur.append(c);
            }
        }
        out.add(cur.toString());
        return out;
    }
}
