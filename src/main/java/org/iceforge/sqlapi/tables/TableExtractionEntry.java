package org.iceforge.sqlapi.tables;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Tables a statement touches, as reported by the database, plus a write heuristic.
 * The table list never changes after creation; only the hit counter moves.
 */
public final class TableExtractionEntry {

    // Fuzzy: may report a write for a read (e.g. a column named "updated"), never the reverse.
    private static final Pattern MAY_WRITE =
            Pattern.compile("(alter|insert|update|delete|create|drop|truncate)", Pattern.CASE_INSENSITIVE);

    private final List<String> affectedTables;
    private final String rawTables;
    private final boolean mayWrite;
    private final AtomicLong hits;

    TableExtractionEntry(List<String> affectedTables, String rawTables, boolean mayWrite) {
        this.affectedTables = List.copyOf(affectedTables);
        this.rawTables = rawTables;
        this.mayWrite = mayWrite;
        this.hits = new AtomicLong(1);
    }

    static TableExtractionEntry create(String sql, List<String> affectedTables) {
        return new TableExtractionEntry(affectedTables, String.join(",", affectedTables), queryMayWrite(sql));
    }

    public static boolean queryMayWrite(String sql) {
        return sql != null && MAY_WRITE.matcher(sql).find();
    }

    public List<String> affectedTables() {
        return affectedTables;
    }

    /** Comma-joined table list, as used in the cache channel header. */
    public String rawTables() {
        return rawTables;
    }

    public boolean mayWrite() {
        return mayWrite;
    }

    public long hits() {
        return hits.get();
    }

    long recordHit() {
        return hits.incrementAndGet();
    }
}
