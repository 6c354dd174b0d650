package org.iceforge.sqlapi.format;

import java.io.IOException;

/**
 * One output format.
 * <p>
 * The dispatcher calls {@link #rewrite} before windowing and execution, then {@link #send}.
 */
public interface ResultEncoder {

    OutputFormat format();

    String contentType();

    /** Extension used in the Content-Disposition filename. */
    String fileExtension();

    /** Statement actually executed for this format. Defaults to the statement as given. */
    default String rewrite(String sql, EncodeOptions options) {
        return sql;
    }

    /** Runs the statement and writes the encoded result to the sink. */
    void send(EncodeRequest request, ResponseSink sink) throws IOException;
}
