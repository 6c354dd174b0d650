package org.iceforge.sqlapi.format;

import org.iceforge.sqlapi.jdbc.TabularResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * RFC 4180 CSV with a header row. Values are written as the database returned them.
 */
public class CsvEncoder extends AbstractRowEncoder {

    private static final String EOL = "\r\n";

    @Override
    public OutputFormat format() {
        return OutputFormat.CSV;
    }

    @Override
    public String contentType() {
        return "text/csv; charset=utf-8; header=present";
    }

    @Override
    public String fileExtension() {
        return "csv";
    }

    @Override
    public void render(TabularResult result, EncodeOptions options, OutputStream out) throws IOException {
        List<String> columns = result.columnsWithout(options.skipFields());
        Writer w = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        writeLine(w, columns);
        for (Map<String, Object> row : result.rows()) {
            for (int i = 0; i < columns.size(); i++) {
                if (i > 0) w.write(',');
                w.write(field(row.get(columns.get(i))));
            }
            w.write(EOL);
        }
        w.flush();
    }

    private static void writeLine(Writer w, List<String> values) throws IOException {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) w.write(',');
            w.write(field(values.get(i)));
        }
        w.write(EOL);
    }

    static String field(Object value) {
        if (value == null) return "";
        String s;
        if (value instanceof Collection<?> c) {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Object o : c) {
                if (!first) sb.append(',');
                sb.append(o == null ? "NULL" : o.toString());
                first = false;
            }
            s = sb.append('}').toString();
        } else {
            s = value.toString();
        }
        if (s.indexOf(',') >= 0 || s.indexOf('"') >= 0 || s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0) {
            return '"' + s.replace("\"", "\"\"") + '"';
        }
        return s;
    }
}
