package org.iceforge.sqlapi.access;

import org.iceforge.sqlapi.error.AccessDeniedException;
import org.iceforge.sqlapi.tables.TableExtractionEntry;

import java.util.regex.Pattern;

/**
 * Rejects statements touching system catalog tables.
 * <p>
 * A safety net against probing, not the security boundary. The match is on a {@code pg_}
 * substring, so a user table such as {@code my_pg_data} is rejected too.
 */
public class AccessGuard {

    private static final Pattern SYSTEM_TABLE = Pattern.compile("\\.?pg_", Pattern.CASE_INSENSITIVE);

    public void check(TableExtractionEntry entry) {
        if (entry == null) return;
        for (String table : entry.affectedTables()) {
            if (isSystemTable(table)) {
                throw new AccessDeniedException("system tables are forbidden");
            }
        }
    }

    static boolean isSystemTable(String table) {
        return table != null && SYSTEM_TABLE.matcher(table).find();
    }
}
