package org.iceforge.sqlapi.tables;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.iceforge.sqlapi.jdbc.ConnectionGateway;
import org.iceforge.sqlapi.jdbc.TabularResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Statement fingerprint -> tables touched by the statement.
 * <p>
 * Entries are bounded in number and expire a fixed time after insertion. Writes never
 * invalidate entries: what is cached is a property of the statement text, not of the data.
 */
public class TableExtractionCache {
    private static final Logger log = LoggerFactory.getLogger(TableExtractionCache.class);

    static final String EXTRACTION_FUNCTION = "CDB_QueryTables";

    // values are futures so the database round-trip runs outside the map's compute lock
    private final AsyncCache<String, TableExtractionEntry> cache;

    public TableExtractionCache(long maxEntries, Duration maxAge) {
        this(maxEntries, maxAge, Ticker.systemTicker());
    }

    TableExtractionCache(long maxEntries, Duration maxAge, Ticker ticker) {
        Objects.requireNonNull(maxAge, "maxAge");
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maxEntries))
                .expireAfterWrite(maxAge)
                .ticker(ticker)
                .buildAsync();
    }

    /**
     * Returns the tables the statement touches, asking the database on a miss.
     * Empty when the database gave an unexpected answer; nothing is cached in that case.
     * Concurrent misses for the same statement share one extraction, run on the thread that
     * missed first.
     */
    public Optional<TableExtractionEntry> lookup(String sql, ConnectionGateway gateway) {
        String key = StatementFingerprint.of(sql);
        CompletableFuture<TableExtractionEntry> mine = new CompletableFuture<>();
        boolean[] owner = {false};
        CompletableFuture<TableExtractionEntry> future = cache.get(key, (k, executor) -> {
            owner[0] = true;
            return mine;
        });

        if (owner[0]) {
            TableExtractionEntry entry;
            try {
                entry = extract(sql, key, gateway);
            } catch (RuntimeException e) {
                mine.completeExceptionally(e);
                throw e;
            }
            // a null value removes the mapping
            mine.complete(entry);
            return Optional.ofNullable(entry);
        }

        TableExtractionEntry entry = await(future);
        if (entry == null) return Optional.empty();
        entry.recordHit();
        return Optional.of(entry);
    }

    private static TableExtractionEntry await(CompletableFuture<TableExtractionEntry> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }

    private TableExtractionEntry extract(String sql, String key, ConnectionGateway gateway) {
        String explain = "SELECT " + EXTRACTION_FUNCTION + "(" + DollarQuote.quote(sql) + ")";
        TabularResult result = gateway.execute(explain);
        if (result.rows().size() != 1) {
            log.error("Unexpected result from {}: {} rows for statement fingerprint {}",
                    EXTRACTION_FUNCTION, result.rows().size(), key);
            return null;
        }

        Object value = result.rows().get(0).values().stream().findFirst().orElse(null);
        try {
            return TableExtractionEntry.create(sql, QueryTablesParser.parse(value));
        } catch (IllegalArgumentException e) {
            log.error("Unexpected result from {} for statement fingerprint {}: {}",
                    EXTRACTION_FUNCTION, key, e.getMessage());
            return null;
        }
    }

    public Stats stats() {
        cache.synchronous().cleanUp();
        long hits = 0;
        long keys = 0;
        for (CompletableFuture<TableExtractionEntry> f : cache.asMap().values()) {
            TableExtractionEntry e = f.isDone() && !f.isCompletedExceptionally() ? f.getNow(null) : null;
            if (e == null) continue;
            hits += e.hits();
            keys++;
        }
        return new Stats(hits, keys);
    }

    public record Stats(long hits, long keys) {}
}
