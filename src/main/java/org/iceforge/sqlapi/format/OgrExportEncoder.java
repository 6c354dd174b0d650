package org.iceforge.sqlapi.format;

import org.iceforge.sqlapi.config.SqlApiProperties;
import org.iceforge.sqlapi.error.ExportFailedException;
import org.iceforge.sqlapi.export.CancellationToken;
import org.iceforge.sqlapi.export.ExportCoalescer;
import org.iceforge.sqlapi.export.ExportWaiter;
import org.iceforge.sqlapi.export.ExternalCommand;
import org.iceforge.sqlapi.export.ZipArchives;
import org.iceforge.sqlapi.jdbc.ConnectionGateway;
import org.iceforge.sqlapi.jdbc.StatementSanitizer;
import org.iceforge.sqlapi.tables.StatementFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Base for file exports produced by {@code ogr2ogr} reading straight from the database.
 * <p>
 * Identical exports (same statement, role, database and options) requested concurrently share
 * one run of the tool; the artifact is streamed to each request and then deleted.
 */
public abstract class OgrExportEncoder implements ResultEncoder {
    private static final Logger log = LoggerFactory.getLogger(OgrExportEncoder.class);

    private final ExportCoalescer coalescer;
    private final ExternalCommand command;
    private final SqlApiProperties.Db db;
    private final SqlApiProperties.Export export;

    protected OgrExportEncoder(ExportCoalescer coalescer, ExternalCommand command, SqlApiProperties props) {
        this.coalescer = coalescer;
        this.command = command;
        this.db = props.getDb();
        this.export = props.getExport();
    }

    /** OGR driver name passed to {@code -f}. */
    protected abstract String driver();

    /** Extension of the file ogr2ogr writes in the work directory. */
    protected abstract String outputExtension();

    /**
     * Turns what ogr2ogr left in {@code workDir} into the artifact at {@code target}.
     * The work directory is deleted afterwards.
     */
    protected abstract void collect(Path workDir, Path output, Path target) throws IOException;

    @Override
    public void send(EncodeRequest request, ResponseSink sink) throws IOException {
        StatementSanitizer.check(request.sql());
        String key = exportKey(request);

        ExportWaiter waiter = new ExportWaiter(sink.body(), new CancellationToken(), sink::isClosed);
        CompletableFuture<Void> done = coalescer.submit(key, () -> generate(request), waiter);
        Duration timeout = export.getWaitTimeout();
        try {
            done.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            waiter.cancel();
            throw new ExportFailedException("Export timed out after " + timeout);
        } catch (CancellationException e) {
            log.debug("Export {} skipped for a cancelled request", key);
        } catch (InterruptedException e) {
            waiter.cancel();
            Thread.currentThread().interrupt();
            throw new ExportFailedException("Interrupted while waiting for export", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) throw io;
            if (cause instanceof RuntimeException re) throw re;
            throw new ExportFailedException("Export failed: " + cause, cause);
        }
    }

    /** Coalescing key: everything that changes the produced file. */
    String exportKey(EncodeRequest request) {
        EncodeOptions o = request.options();
        ConnectionGateway g = request.gateway();
        return StatementFingerprint.of(String.join("|",
                format().id(), g.database(), g.role(),
                Integer.toString(o.decimalPrecision()), o.geometryColumn(), o.filename(), request.sql()));
    }

    Path generate(EncodeRequest request) throws IOException {
        Path base = tmpDir();
        Files.createDirectories(base);
        Path workDir = Files.createTempDirectory(base, "sqlapi_" + format().id() + "_");
        Path target = base.resolve(workDir.getFileName() + "." + fileExtension());
        try {
            Path output = workDir.resolve(request.options().filename() + "." + outputExtension());
            long start = System.nanoTime();
            command.run(commandLine(request, output), workDir);
            collect(workDir, output, target);
            log.info("Generated {} export {} in {} ms", format().id(), target.getFileName(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            return target;
        } finally {
            ZipArchives.deleteRecursively(workDir);
        }
    }

    List<String> commandLine(EncodeRequest request, Path output) {
        List<String> args = new ArrayList<>();
        args.add(export.getOgr2ogrCommand());
        args.add("-f");
        args.add(driver());
        args.add("-lco");
        args.add("ENCODING=UTF-8");
        args.add(output.toString());
        args.add(connectionString(request.gateway()));
        args.add("-sql");
        args.add(request.sql());
        args.add("-nln");
        args.add(request.options().filename());
        return args;
    }

    String connectionString(ConnectionGateway gateway) {
        StringBuilder sb = new StringBuilder("PG:")
                .append("host=").append(quote(db.getHost()))
                .append(" port=").append(db.getPort())
                .append(" user=").append(quote(gateway.role()))
                .append(" dbname=").append(quote(gateway.database()));
        if (db.getPassword() != null && !db.getPassword().isEmpty()) {
            sb.append(" password=").append(quote(db.getPassword()));
        }
        return sb.toString();
    }

    // libpq keyword/value quoting
    static String quote(String value) {
        if (!value.isEmpty() && value.chars().noneMatch(c -> c == ' ' || c == '\'' || c == '\\')) return value;
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private Path tmpDir() {
        Path dir = export.getTmpDir();
        return dir != null ? dir : Paths.get(System.getProperty("java.io.tmpdir"));
    }
}
