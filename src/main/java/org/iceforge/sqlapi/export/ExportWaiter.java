package org.iceforge.sqlapi.export;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * One request waiting for an export: where to copy the artifact and how to tell it is gone.
 * <p>
 * Writes and {@link #cancel()} share a lock, so once {@code cancel()} returns nothing more
 * reaches the stream.
 */
public final class ExportWaiter {
    private final OutputStream out;
    private final CancellationToken token;
    private final BooleanSupplier clientGone;
    // fair: a pending cancel() goes before the next chunk
    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    public ExportWaiter(OutputStream out, CancellationToken token) {
        this(out, token, () -> false);
    }

    /**
     * @param clientGone true once the client disconnected, e.g. {@code sink::isClosed}
     */
    public ExportWaiter(OutputStream out, CancellationToken token, BooleanSupplier clientGone) {
        this.out = Objects.requireNonNull(out, "out");
        this.token = Objects.requireNonNull(token, "token");
        this.clientGone = Objects.requireNonNull(clientGone, "clientGone");
    }

    public boolean isCancelled() {
        return token.isCancelled() || clientGone.getAsBoolean();
    }

    /** Cancels the waiter, blocking while a chunk is being written to it. */
    public void cancel() {
        writeLock.lock();
        try {
            token.cancel();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Writes one chunk.
     *
     * @return false, with nothing written, when the waiter is cancelled or its client is gone
     */
    boolean write(byte[] chunk, int off, int len) throws IOException {
        writeLock.lock();
        try {
            if (isCancelled()) return false;
            out.write(chunk, off, len);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    boolean flush() throws IOException {
        writeLock.lock();
        try {
            if (isCancelled()) return false;
            out.flush();
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /** Completes once the artifact has been copied, or exceptionally when this waiter could not be served. */
    public CompletableFuture<Void> future() {
        return done;
    }
}
