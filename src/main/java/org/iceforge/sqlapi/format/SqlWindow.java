package org.iceforge.sqlapi.format;

import java.util.regex.Pattern;

/**
 * LIMIT/OFFSET paging by wrapping the statement in an outer select.
 * <p>
 * Only statements starting with SELECT are wrapped. WITH and VALUES statements are left
 * as they are, so paging parameters are ignored for them.
 */
public final class SqlWindow {
    private static final Pattern LEADING_SELECT = Pattern.compile("^\\s*SELECT\\s", Pattern.CASE_INSENSITIVE);

    private SqlWindow() {}

    public static String apply(String sql, Integer limit, Long offset) {
        if (limit != null && offset != null && LEADING_SELECT.matcher(sql).find()) {
            return "SELECT * FROM (" + sql + ") AS cdbq_1 LIMIT " + limit + " OFFSET " + offset;
        }
        return sql;
    }
}
