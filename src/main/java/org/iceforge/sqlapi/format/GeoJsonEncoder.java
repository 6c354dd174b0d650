package org.iceforge.sqlapi.format;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.sqlapi.jdbc.TabularResult;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

/**
 * GeoJSON FeatureCollection, one feature per row.
 * <p>
 * The database serializes the geometry; its JSON is copied into the output untouched so the
 * coordinate rounding requested with {@code dp} is preserved.
 */
public class GeoJsonEncoder extends AbstractRowEncoder {

    static final String WEBMERCATOR_COLUMN = "the_geom_webmercator";

    private final ObjectMapper mapper;

    public GeoJsonEncoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.GEOJSON;
    }

    @Override
    public String contentType() {
        return "application/json; charset=utf-8";
    }

    @Override
    public String fileExtension() {
        return "geojson";
    }

    @Override
    public String rewrite(String sql, EncodeOptions options) {
        String gn = options.geometryColumn();
        return "SELECT *, ST_AsGeoJSON(" + gn + "," + options.decimalPrecision() + ") as " + gn
                + " FROM (" + sql + ") as foo";
    }

    @Override
    public void render(TabularResult result, EncodeOptions options, OutputStream out) throws IOException {
        String gn = options.geometryColumn();
        try (JsonGenerator gen = mapper.getFactory().createGenerator(out)) {
            gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
            gen.writeStartObject();
            gen.writeStringField("type", "FeatureCollection");
            gen.writeArrayFieldStart("features");
            for (Map<String, Object> row : result.rowsWithout(options.skipFields())) {
                gen.writeStartObject();
                gen.writeStringField("type", "Feature");
                gen.writeObjectFieldStart("properties");
                for (Map.Entry<String, Object> e : row.entrySet()) {
                    if (e.getKey().equals(gn) || e.getKey().equals(WEBMERCATOR_COLUMN)) continue;
                    gen.writeObjectField(e.getKey(), e.getValue());
                }
                gen.writeEndObject();
                gen.writeFieldName("geometry");
                Object geometry = row.get(gn);
                if (geometry == null) {
                    gen.writeNull();
                } else {
                    gen.writeRawValue(geometry.toString());
                }
                gen.writeEndObject();
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }
    }
}
