package org.iceforge.sqlapi.tables;

import com.github.benmanes.caffeine.cache.Ticker;
import org.iceforge.sqlapi.error.UpstreamDatabaseException;
import org.iceforge.sqlapi.jdbc.TabularResult;
import org.iceforge.sqlapi.testing.ScriptedGateway;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TableExtractionCacheTest {

    private static final String EXTRACTION = "SELECT CDB_QueryTables(";

    @Test
    void miss_queries_the_database_and_hit_counts_up() {
        ScriptedGateway gw = new ScriptedGateway("publicuser", "db").tables("{public.places,public.roads}");
        TableExtractionCache cache = new TableExtractionCache(100, Duration.ofMinutes(10));

        TableExtractionEntry first = cache.lookup("SELECT * FROM places, roads", gw).orElseThrow();
        assertEquals(List.of("public.places", "public.roads"), first.affectedTables());
        assertEquals("public.places,public.roads", first.rawTables());
        assertEquals(1, first.hits());

        TableExtractionEntry second = cache.lookup("SELECT * FROM places, roads", gw).orElseThrow();
        assertSame(first, second);
        assertEquals(2, second.hits());
        assertEquals(1, gw.count(s -> s.startsWith(EXTRACTION)));
    }

    @Test
    void extraction_statement_dollar_quotes_the_sql() {
        ScriptedGateway gw = new ScriptedGateway("publicuser", "db").tables("{t}");
        TableExtractionCache cache = new TableExtractionCache(100, Duration.ofMinutes(10));

        cache.lookup("SELECT 'it''s' FROM t", gw);

        assertEquals("SELECT CDB_QueryTables($quotesql$SELECT 'it''s' FROM t$quotesql$)", gw.executed().get(0));
    }

    @Test
    void unexpected_row_count_is_not_cached() {
        ScriptedGateway gw = new ScriptedGateway("publicuser", "db")
                .onPrefix(EXTRACTION, TabularResult.empty(0));
        TableExtractionCache cache = new TableExtractionCache(100, Duration.ofMinutes(10));

        assertEquals(Optional.empty(), cache.lookup("SELECT 1", gw));
        assertEquals(Optional.empty(), cache.lookup("SELECT 1", gw));
        assertEquals(2, gw.count(s -> s.startsWith(EXTRACTION)));
        assertEquals(0, cache.stats().keys());
    }

    @Test
    void unparseable_answer_is_not_cached() {
        ScriptedGateway gw = new ScriptedGateway("publicuser", "db").tables("not an array");
        TableExtractionCache cache = new TableExtractionCache(100, Duration.ofMinutes(10));

        assertTrue(cache.lookup("SELECT 1", gw).isEmpty());
        assertEquals(0, cache.stats().keys());
    }

    @Test
    void database_error_propagates() {
        ScriptedGateway gw = new ScriptedGateway("publicuser", "db").on(s -> true, s -> {
            throw new UpstreamDatabaseException("syntax error at or near \"FROMM\"", "ERROR", "42601", false, null);
        });
        TableExtractionCache cache = new TableExtractionCache(100, Duration.ofMinutes(10));

        UpstreamDatabaseException e = assertThrows(UpstreamDatabaseException.class,
                () -> cache.lookup("SELECT * FROMM t", gw));
        assertEquals("syntax error at or near \"FROMM\"", e.getMessage());
    }

    @Test
    void entries_expire_after_max_age_from_insertion() {
        AtomicLong nanos = new AtomicLong();
        Ticker ticker = nanos::get;
        ScriptedGateway gw = new ScriptedGateway("publicuser", "db").tables("{t}");
        TableExtractionCache cache = new TableExtractionCache(100, Duration.ofMinutes(10), ticker);

        cache.lookup("SELECT * FROM t", gw);
        nanos.addAndGet(Duration.ofMinutes(9).toNanos());
        cache.lookup("SELECT * FROM t", gw);
        assertEquals(1, gw.count(s -> s.startsWith(EXTRACTION)));

        // a hit does not extend the lifetime
        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        TableExtractionEntry fresh = cache.lookup("SELECT * FROM t", gw).orElseThrow();
        assertEquals(2, gw.count(s -> s.startsWith(EXTRACTION)));
        assertEquals(1, fresh.hits());
    }

    @Test
    void stats_sum_hits_over_live_entries() {
        ScriptedGateway gw = new ScriptedGateway("publicuser", "db").tables("{t}");
        TableExtractionCache cache = new TableExtractionCache(100, Duration.ofMinutes(10));

        cache.lookup("SELECT a FROM t", gw);
        cache.lookup("SELECT a FROM t", gw);
        cache.lookup("SELECT b FROM t", gw);

        TableExtractionCache.Stats stats = cache.stats();
        assertEquals(2, stats.keys());
        assertEquals(3, stats.hits());
    }

    @Test
    void concurrent_misses_share_one_extraction() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ScriptedGateway gw = new ScriptedGateway("publicuser", "db").on(s -> s.startsWith(EXTRACTION), s -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ScriptedGateway.rows(List.of("cdb_querytables"), List.of("{t}"));
        });
        TableExtractionCache cache = new TableExtractionCache(100, Duration.ofMinutes(10));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Optional<TableExtractionEntry>>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(pool.submit(() -> cache.lookup("SELECT * FROM t", gw)));
            }
            Thread.sleep(100);
            release.countDown();
            for (Future<Optional<TableExtractionEntry>> f : futures) {
                assertEquals("t", f.get(5, TimeUnit.SECONDS).orElseThrow().rawTables());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, gw.count(s -> s.startsWith(EXTRACTION)));
        assertEquals(4, cache.stats().hits());
    }

    @Test
    void slow_extraction_does_not_hold_up_other_statements() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ScriptedGateway gw = new ScriptedGateway("publicuser", "db")
                .on(s -> s.startsWith(EXTRACTION) && s.contains("slow"), s -> {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return ScriptedGateway.rows(List.of("cdb_querytables"), List.of("{slow}"));
                })
                .tables("{fast}");
        TableExtractionCache cache = new TableExtractionCache(100, Duration.ofMinutes(10));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Optional<TableExtractionEntry>> slow = pool.submit(() -> cache.lookup("SELECT * FROM slow", gw));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            for (int i = 0; i < 50; i++) {
                String sql = "SELECT " + i + " FROM fast";
                Future<Optional<TableExtractionEntry>> fast = pool.submit(() -> cache.lookup(sql, gw));
                assertEquals("fast", fast.get(2, TimeUnit.SECONDS).orElseThrow().rawTables());
            }
            assertFalse(slow.isDone());

            release.countDown();
            assertEquals("slow", slow.get(5, TimeUnit.SECONDS).orElseThrow().rawTables());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void failed_extraction_reaches_concurrent_waiters_and_is_retried() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicLong calls = new AtomicLong();
        ScriptedGateway gw = new ScriptedGateway("publicuser", "db").on(s -> s.startsWith(EXTRACTION), s -> {
            if (calls.incrementAndGet() == 1) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new UpstreamDatabaseException("canceling statement due to statement timeout", "ERROR", "57014", false, null);
            }
            return ScriptedGateway.rows(List.of("cdb_querytables"), List.of("{t}"));
        });
        TableExtractionCache cache = new TableExtractionCache(100, Duration.ofMinutes(10));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Optional<TableExtractionEntry>> first = pool.submit(() -> cache.lookup("SELECT * FROM t", gw));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            Future<Optional<TableExtractionEntry>> second = pool.submit(() -> cache.lookup("SELECT * FROM t", gw));
            Thread.sleep(100);
            release.countDown();

            for (Future<Optional<TableExtractionEntry>> f : List.of(first, second)) {
                ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(5, TimeUnit.SECONDS));
                assertInstanceOf(UpstreamDatabaseException.class, e.getCause());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(0, cache.stats().keys());
        assertEquals("t", cache.lookup("SELECT * FROM t", gw).orElseThrow().rawTables());
    }
}
