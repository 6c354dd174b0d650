package org.iceforge.sqlapi.export;

import org.iceforge.sqlapi.error.ExportFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one generation per export key no matter how many requests ask for it.
 * <p>
 * The first request for a key starts the generator on the executor; later requests for the
 * same key queue up behind it. Once the artifact exists, waiters are served one after the other
 * in arrival order, including waiters that join while others are being served. A waiter whose
 * client is gone is skipped; one cancelled mid-copy gets no further bytes. The key is
 * removed when the queue is empty, and the artifact is then deleted. A request arriving after
 * that starts a fresh generation.
 */
public class ExportCoalescer {
    private static final Logger log = LoggerFactory.getLogger(ExportCoalescer.class);

    static final int CHUNK_SIZE = 64 * 1024;

    enum State { GENERATING, DRAINING }

    static final class PendingExport {
        final String key;
        final Queue<ExportWaiter> waiters = new ArrayDeque<>();
        State state = State.GENERATING;
        int served;

        PendingExport(String key) {
            this.key = key;
        }
    }

    private final ExecutorService executor;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, PendingExport> pending = new HashMap<>();

    public ExportCoalescer(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Registers the waiter under the key, starting the generator if no export for the key is
     * pending. The returned future is the waiter's own.
     */
    public CompletableFuture<Void> submit(String key, ExportGenerator generator, ExportWaiter waiter) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(generator, "generator");
        PendingExport started = null;
        lock.lock();
        try {
            PendingExport p = pending.get(key);
            if (p == null) {
                p = new PendingExport(key);
                pending.put(key, p);
                started = p;
            }
            p.waiters.add(waiter);
        } finally {
            lock.unlock();
        }

        if (started != null) {
            PendingExport p = started;
            try {
                executor.execute(() -> run(p, generator));
            } catch (RejectedExecutionException e) {
                failAll(p, e);
            }
        }
        return waiter.future();
    }

    /** Keys with a generation or fan-out in progress. */
    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    private void run(PendingExport p, ExportGenerator generator) {
        Path artifact;
        try {
            artifact = generator.generate();
        } catch (Exception e) {
            log.error("Export generation failed for key {}", p.key, e);
            failAll(p, e);
            return;
        }
        if (artifact == null) {
            failAll(p, new ExportFailedException("Export produced no file"));
            return;
        }
        drain(p, artifact);
    }

    private void drain(PendingExport p, Path artifact) {
        lock.lock();
        try {
            p.state = State.DRAINING;
        } finally {
            lock.unlock();
        }

        while (true) {
            ExportWaiter next;
            lock.lock();
            try {
                next = p.waiters.poll();
                if (next == null) {
                    pending.remove(p.key, p);
                    break;
                }
                p.served++;
            } finally {
                lock.unlock();
            }
            serve(next, artifact);
        }

        log.debug("Export {} served to {} waiter(s)", p.key, p.served);
        delete(artifact);
    }

    static void serve(ExportWaiter waiter, Path artifact) {
        if (waiter.isCancelled()) {
            waiter.future().cancel(false);
            return;
        }
        try (InputStream in = Files.newInputStream(artifact)) {
            byte[] chunk = new byte[CHUNK_SIZE];
            int n;
            while ((n = in.read(chunk)) != -1) {
                if (!waiter.write(chunk, 0, n)) {
                    waiter.future().cancel(false);
                    return;
                }
            }
            if (!waiter.flush()) {
                waiter.future().cancel(false);
                return;
            }
            waiter.future().complete(null);
        } catch (IOException | RuntimeException e) {
            // only this client is affected
            waiter.cancel();
            waiter.future().completeExceptionally(e);
        }
    }

    private void failAll(PendingExport p, Throwable cause) {
        List<ExportWaiter> waiters;
        lock.lock();
        try {
            pending.remove(p.key, p);
            waiters = new ArrayList<>(p.waiters);
            p.waiters.clear();
        } finally {
            lock.unlock();
        }
        RuntimeException failure = cause instanceof RuntimeException re
                ? re
                : new ExportFailedException("Export failed: " + cause.getMessage(), cause);
        for (ExportWaiter w : waiters) {
            w.future().completeExceptionally(failure);
        }
    }

    static void delete(Path artifact) {
        try {
            Files.delete(artifact);
        } catch (NoSuchFileException e) {
            log.debug("Export artifact already gone: {}", artifact);
        } catch (IOException e) {
            log.warn("Could not delete export artifact {}: {}", artifact, e.toString());
        }
    }
}
