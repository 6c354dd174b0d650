package org.iceforge.sqlapi.format;

import java.util.Set;

/**
 * Per-request options the encoders see.
 *
 * @param geometryColumn   column holding the geometry (geo-aware formats)
 * @param decimalPrecision digits kept in geometry coordinates
 * @param skipFields       columns removed from every row; unknown names are ignored
 * @param filename         sanitized base filename, without extension
 * @param startNanos       {@link System#nanoTime()} when the request entered the dispatcher
 */
public record EncodeOptions(String geometryColumn,
                            int decimalPrecision,
                            Set<String> skipFields,
                            String filename,
                            long startNanos) {

    public EncodeOptions {
        skipFields = skipFields == null ? Set.of() : Set.copyOf(skipFields);
    }

    /** Seconds since the request entered the dispatcher. */
    public double elapsedSeconds() {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
