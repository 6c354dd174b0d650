package org.iceforge.sqlapi.format;

import org.iceforge.sqlapi.jdbc.TabularResult;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Base for formats rendered in-process from a materialized result.
 * The whole result is fetched before the first byte is written.
 */
public abstract class AbstractRowEncoder implements ResultEncoder {

    @Override
    public void send(EncodeRequest request, ResponseSink sink) throws IOException {
        TabularResult result = request.gateway().execute(request.sql());
        OutputStream out = sink.body();
        render(result, request.options(), out);
        out.flush();
    }

    public abstract void render(TabularResult result, EncodeOptions options, OutputStream out) throws IOException;
}
