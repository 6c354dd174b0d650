package org.iceforge.sqlapi.format;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.sqlapi.jdbc.TabularResult;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

/**
 * {@code {"time": s, "total_rows": n, "rows": [...]}}.
 */
public class JsonEncoder extends AbstractRowEncoder {

    private final ObjectMapper mapper;

    public JsonEncoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public String contentType() {
        return "application/json; charset=utf-8";
    }

    @Override
    public String fileExtension() {
        return "json";
    }

    @Override
    public void render(TabularResult result, EncodeOptions options, OutputStream out) throws IOException {
        double time = options.elapsedSeconds();
        try (JsonGenerator gen = mapper.getFactory().createGenerator(out)) {
            gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
            gen.writeStartObject();
            gen.writeNumberField("time", time);
            gen.writeNumberField("total_rows", result.rowCount());
            gen.writeArrayFieldStart("rows");
            for (Map<String, Object> row : result.rowsWithout(options.skipFields())) {
                gen.writeObject(row);
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }
    }
}
