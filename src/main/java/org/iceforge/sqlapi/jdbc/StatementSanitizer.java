package org.iceforge.sqlapi.jdbc;

import org.iceforge.sqlapi.error.AccessDeniedException;

import java.util.regex.Pattern;

/**
 * Rejects statements that would change state on a connection shared across requests.
 * <p>
 * This is a syntactic check only; database grants are the real boundary.
 */
public final class StatementSanitizer {
    private static final Pattern LEADING_SET = Pattern.compile("^\\s*set\\s+", Pattern.CASE_INSENSITIVE);

    private StatementSanitizer() {}

    public static void check(String sql) {
        if (sql != null && LEADING_SET.matcher(sql).find()) {
            throw new AccessDeniedException("SET command is forbidden");
        }
    }
}
