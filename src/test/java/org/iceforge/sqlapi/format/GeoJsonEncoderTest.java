package org.iceforge.sqlapi.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.sqlapi.jdbc.TabularResult;
import org.iceforge.sqlapi.testing.ScriptedGateway;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GeoJsonEncoderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final GeoJsonEncoder encoder = new GeoJsonEncoder(mapper);

    @Test
    void rewrite_casts_geometry_with_requested_precision() {
        EncodeOptions o = new EncodeOptions("the_geom", 2, Set.of(), "q", System.nanoTime());
        assertEquals("SELECT *, ST_AsGeoJSON(the_geom,2) as the_geom FROM (SELECT * FROM t) as foo",
                encoder.rewrite("SELECT * FROM t", o));
    }

    @Test
    void renders_feature_collection_with_verbatim_geometry() throws Exception {
        TabularResult result = ScriptedGateway.rows(List.of("cartodb_id", "name", "the_geom_webmercator", "the_geom"),
                List.of(1, "a", "0101000020110F", "{\"type\":\"Point\",\"coordinates\":[1.12,2.5]}"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        encoder.render(result, new EncodeOptions("the_geom", 2, Set.of(), "q", System.nanoTime()), out);

        JsonNode json = mapper.readTree(out.toByteArray());
        assertEquals("FeatureCollection", json.get("type").asText());
        JsonNode feature = json.get("features").get(0);
        assertEquals("Feature", feature.get("type").asText());
        assertEquals(mapper.readTree("{\"cartodb_id\":1,\"name\":\"a\"}"), feature.get("properties"));
        assertEquals(1.12, feature.get("geometry").get("coordinates").get(0).asDouble());
        // database rounding is kept as text
        assertTrue(out.toString().contains("[1.12,2.5]"));
    }

    @Test
    void null_geometry_renders_as_json_null() throws Exception {
        TabularResult result = ScriptedGateway.rows(List.of("cartodb_id", "the_geom"), Arrays.asList(7, null));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        encoder.render(result, new EncodeOptions("the_geom", 6, Set.of(), "q", System.nanoTime()), out);

        JsonNode feature = mapper.readTree(out.toByteArray()).get("features").get(0);
        assertTrue(feature.has("geometry"));
        assertTrue(feature.get("geometry").isNull());
        assertEquals(7, feature.get("properties").get("cartodb_id").asInt());
    }

    @Test
    void skip_fields_drop_properties() throws Exception {
        TabularResult result = ScriptedGateway.rows(List.of("a", "b", "the_geom"),
                List.of(1, 2, "{\"type\":\"Point\",\"coordinates\":[0,0]}"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        encoder.render(result, new EncodeOptions("the_geom", 6, Set.of("b"), "q", System.nanoTime()), out);

        JsonNode props = mapper.readTree(out.toByteArray()).get("features").get(0).get("properties");
        assertTrue(props.has("a"));
        assertFalse(props.has("b"));
    }
}
