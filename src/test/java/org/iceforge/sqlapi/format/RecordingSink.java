package org.iceforge.sqlapi.format;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sink collecting headers and body in memory.
 */
public class RecordingSink implements ResponseSink {

    private final Map<String, String> headers = new LinkedHashMap<>();
    private final ByteArrayOutputStream body = new ByteArrayOutputStream();
    private volatile boolean closed;

    @Override
    public void setHeader(String name, String value) {
        headers.put(name, value);
    }

    @Override
    public OutputStream body() {
        return body;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    /** Simulates a client that disconnected. */
    public RecordingSink close() {
        closed = true;
        return this;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public byte[] bytes() {
        return body.toByteArray();
    }

    public String text() {
        return body.toString(java.nio.charset.StandardCharsets.UTF_8);
    }
}
