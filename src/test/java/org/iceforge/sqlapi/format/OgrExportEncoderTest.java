package org.iceforge.sqlapi.format;

import org.iceforge.sqlapi.config.SqlApiProperties;
import org.iceforge.sqlapi.error.AccessDeniedException;
import org.iceforge.sqlapi.error.ExportFailedException;
import org.iceforge.sqlapi.export.ExportCoalescer;
import org.iceforge.sqlapi.export.ExternalCommand;
import org.iceforge.sqlapi.testing.ScriptedGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.*;

class OgrExportEncoderTest {

    @TempDir
    Path tmp;

    private ExecutorService executor;
    private ExportCoalescer coalescer;
    private SqlApiProperties props;
    private FakeOgr2ogr ogr;

    /** Writes the files ogr2ogr would write instead of running it. */
    static class FakeOgr2ogr extends ExternalCommand {
        final List<List<String>> calls = new CopyOnWriteArrayList<>();
        volatile String failWith;

        FakeOgr2ogr() {
            super(Duration.ofSeconds(5));
        }

        @Override
        public String run(List<String> command, Path workDir) {
            calls.add(command);
            if (failWith != null) throw new ExportFailedException(failWith);
            Path output = Path.of(command.get(5));
            try {
                if (command.get(2).equals("KML")) {
                    Files.writeString(output, "<kml/>");
                } else {
                    String base = output.getFileName().toString().replace(".shp", "");
                    for (String ext : List.of("shp", "shx", "dbf")) {
                        Files.writeString(workDir.resolve(base + "." + ext), ext);
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return "";
        }
    }

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        coalescer = new ExportCoalescer(executor);
        props = new SqlApiProperties();
        props.getExport().setTmpDir(tmp);
        props.getExport().setWaitTimeout(Duration.ofSeconds(5));
        props.getDb().setHost("db.local");
        props.getDb().setPort(6432);
        ogr = new FakeOgr2ogr();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private EncodeRequest request(String sql) {
        return new EncodeRequest(sql, new EncodeOptions("the_geom", 6, Set.of(), "my_export", System.nanoTime()),
                new ScriptedGateway("publicuser", "tenant_db"));
    }

    @Test
    void kml_streams_the_generated_file_and_cleans_up() throws Exception {
        KmlEncoder encoder = new KmlEncoder(coalescer, ogr, props);
        RecordingSink sink = new RecordingSink();

        encoder.send(request("SELECT * FROM places"), sink);

        assertEquals("<kml/>", sink.text());
        assertEquals(1, ogr.calls.size());
        List<String> args = ogr.calls.get(0);
        assertEquals(List.of("ogr2ogr", "-f", "KML", "-lco", "ENCODING=UTF-8"), args.subList(0, 5));
        assertTrue(args.get(5).endsWith("my_export.kml"));
        assertEquals("PG:host=db.local port=6432 user=publicuser dbname=tenant_db", args.get(6));
        assertEquals(List.of("-sql", "SELECT * FROM places", "-nln", "my_export"), args.subList(7, 11));
        // the artifact is deleted right after the last waiter is served
        long deadline = System.currentTimeMillis() + 5000;
        while (true) {
            try (var files = Files.list(tmp)) {
                if (files.findAny().isEmpty()) break;
            }
            assertTrue(System.currentTimeMillis() < deadline, "export artifact was not deleted");
            Thread.sleep(10);
        }
    }

    @Test
    void disconnected_client_gets_nothing() throws Exception {
        KmlEncoder encoder = new KmlEncoder(coalescer, ogr, props);
        RecordingSink sink = new RecordingSink().close();

        encoder.send(request("SELECT * FROM places"), sink);

        assertEquals(0, sink.bytes().length);
        assertEquals(1, ogr.calls.size());
    }

    @Test
    void shapefile_is_zipped() throws Exception {
        ShapefileEncoder encoder = new ShapefileEncoder(coalescer, ogr, props);
        RecordingSink sink = new RecordingSink();

        encoder.send(request("SELECT * FROM places"), sink);

        int entries = 0;
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(sink.bytes()))) {
            while (zip.getNextEntry() != null) entries++;
        }
        assertEquals(3, entries);
        assertEquals("ESRI Shapefile", ogr.calls.get(0).get(2));
        assertEquals("application/zip", encoder.contentType());
        assertEquals("zip", encoder.fileExtension());
    }

    @Test
    void tool_failure_surfaces_as_export_failure() {
        ogr.failWith = "ERROR 1: SQL Expression Parsing Error";
        KmlEncoder encoder = new KmlEncoder(coalescer, ogr, props);

        ExportFailedException e = assertThrows(ExportFailedException.class,
                () -> encoder.send(request("SELECT * FROM places"), new RecordingSink()));
        assertEquals("ERROR 1: SQL Expression Parsing Error", e.getMessage());
    }

    @Test
    void set_statements_never_reach_the_tool() {
        KmlEncoder encoder = new KmlEncoder(coalescer, ogr, props);

        assertThrows(AccessDeniedException.class, () -> encoder.send(request("SET role postgres"), new RecordingSink()));
        assertTrue(ogr.calls.isEmpty());
    }

    @Test
    void export_key_depends_on_everything_that_changes_the_file() {
        KmlEncoder encoder = new KmlEncoder(coalescer, ogr, props);
        EncodeRequest base = request("SELECT 1");

        assertEquals(encoder.exportKey(base), encoder.exportKey(request("SELECT 1")));
        assertNotEquals(encoder.exportKey(base), encoder.exportKey(request("SELECT 2")));
        EncodeRequest otherRole = new EncodeRequest("SELECT 1", base.options(), new ScriptedGateway("tenant_user_1", "tenant_db"));
        assertNotEquals(encoder.exportKey(base), encoder.exportKey(otherRole));
        EncodeRequest otherName = new EncodeRequest("SELECT 1",
                new EncodeOptions("the_geom", 6, Set.of(), "other", System.nanoTime()), base.gateway());
        assertNotEquals(encoder.exportKey(base), encoder.exportKey(otherName));
    }

    @Test
    void connection_string_quotes_values_with_spaces_and_quotes() {
        props.getDb().setPassword("it's secret");
        KmlEncoder encoder = new KmlEncoder(coalescer, ogr, props);

        assertEquals("PG:host=db.local port=6432 user=publicuser dbname=tenant_db password='it\\'s secret'",
                encoder.connectionString(new ScriptedGateway("publicuser", "tenant_db")));
    }
}
