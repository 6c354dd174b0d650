package org.iceforge.sqlapi.format;

import org.iceforge.sqlapi.jdbc.TabularResult;
import org.iceforge.sqlapi.testing.ScriptedGateway;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CsvEncoderTest {

    private final CsvEncoder encoder = new CsvEncoder();

    private String render(TabularResult result, Set<String> skip) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        encoder.render(result, new EncodeOptions("the_geom", 6, skip, "q", System.nanoTime()), out);
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void header_row_then_one_line_per_row() throws Exception {
        String csv = render(ScriptedGateway.rows(List.of("id", "name"),
                List.of(1, "oslo"), Arrays.asList(2, null)), Set.of());

        assertEquals("id,name\r\n1,oslo\r\n2,\r\n", csv);
    }

    @Test
    void quotes_fields_with_separators_quotes_and_newlines() throws Exception {
        String csv = render(ScriptedGateway.rows(List.of("v"),
                List.of("a,b"), List.of("say \"hi\""), List.of("two\nlines")), Set.of());

        assertEquals("v\r\n\"a,b\"\r\n\"say \"\"hi\"\"\"\r\n\"two\nlines\"\r\n", csv);
    }

    @Test
    void skipped_columns_leave_header_and_rows() throws Exception {
        String csv = render(ScriptedGateway.rows(List.of("id", "the_geom"), List.of(1, "0101")), Set.of("the_geom"));

        assertEquals("id\r\n1\r\n", csv);
    }

    @Test
    void arrays_use_postgres_literal_form() {
        assertEquals("\"{1,2,NULL}\"", CsvEncoder.field(Arrays.asList(1, 2, null)));
        assertEquals("{x}", CsvEncoder.field(List.of("x")));
    }

    @Test
    void content_type_declares_header() {
        assertEquals("text/csv; charset=utf-8; header=present", encoder.contentType());
        assertEquals("csv", encoder.fileExtension());
    }
}
