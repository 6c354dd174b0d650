package org.iceforge.sqlapi.export;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Set when the client went away or its wait timed out.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
