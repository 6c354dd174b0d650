package org.iceforge.sqlapi.api;

import jakarta.servlet.http.HttpServletResponse;
import org.iceforge.sqlapi.format.ResponseSink;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * {@link ResponseSink} over a servlet response. A failed write marks the sink closed.
 */
class ServletResponseSink implements ResponseSink {

    private final HttpServletResponse response;
    private OutputStream body;
    private volatile boolean closed;

    ServletResponseSink(HttpServletResponse response) {
        this.response = response;
    }

    @Override
    public void setHeader(String name, String value) {
        if ("Content-Type".equalsIgnoreCase(name)) {
            response.setContentType(value);
        } else {
            response.setHeader(name, value);
        }
    }

    @Override
    public synchronized OutputStream body() throws IOException {
        if (body == null) {
            body = new FilterOutputStream(response.getOutputStream()) {
                @Override
                public void write(int b) throws IOException {
                    try {
                        out.write(b);
                    } catch (IOException e) {
                        closed = true;
                        throw e;
                    }
                }

                @Override
                public void write(byte[] b, int off, int len) throws IOException {
                    try {
                        out.write(b, off, len);
                    } catch (IOException e) {
                        closed = true;
                        throw e;
                    }
                }

                @Override
                public void flush() throws IOException {
                    try {
                        out.flush();
                    } catch (IOException e) {
                        closed = true;
                        throw e;
                    }
                }

                @Override
                public void close() throws IOException {
                    // the container owns the servlet stream
                    flush();
                }
            };
        }
        return body;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }
}
