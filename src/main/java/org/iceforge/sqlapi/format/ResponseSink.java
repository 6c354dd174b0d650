package org.iceforge.sqlapi.format;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Where a response goes: headers first, then the body stream.
 */
public interface ResponseSink {

    void setHeader(String name, String value);

    OutputStream body() throws IOException;

    /** True once the client went away or a write to it failed. */
    boolean isClosed();
}
