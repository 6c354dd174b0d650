package org.iceforge.sqlapi.format.binary;

import org.iceforge.sqlapi.format.AbstractRowEncoder;
import org.iceforge.sqlapi.format.EncodeOptions;
import org.iceforge.sqlapi.format.OutputFormat;
import org.iceforge.sqlapi.jdbc.TabularResult;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Column-oriented binary container.
 * <p>
 * Layout: {@code 'T' 'B' 'L'}, version byte, then one BUFFER block holding a STRING block
 * with the column names followed by one block per column. Column types come from the first
 * row: strings become STRING, arrays become a BUFFER of per-row blocks, anything else is
 * FLOAT32 unless the column name carries a type suffix. An empty result is an empty body.
 */
public class BinaryEncoder extends AbstractRowEncoder {

    static final byte[] FILE_TAG = {'T', 'B', 'L'};
    static final byte VERSION = 1;

    @Override
    public OutputFormat format() {
        return OutputFormat.ARRAYBUFFER;
    }

    @Override
    public String contentType() {
        return "application/octet-stream";
    }

    @Override
    public String fileExtension() {
        return "bin";
    }

    @Override
    public void render(TabularResult result, EncodeOptions options, OutputStream out) throws IOException {
        List<Map<String, Object>> rows = result.rowsWithout(options.skipFields());
        if (rows.isEmpty()) return;
        List<String> columns = result.columnsWithout(options.skipFields());

        List<byte[]> blocks = new ArrayList<>(columns.size() + 1);
        blocks.add(BinaryBlocks.strings(columns));
        Map<String, Object> first = rows.get(0);
        for (String column : columns) {
            List<Object> values = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) values.add(row.get(column));
            blocks.add(columnBlock(column, first.get(column), values));
        }

        out.write(FILE_TAG);
        out.write(VERSION);
        out.write(BinaryBlocks.buffer(blocks));
    }

    private static byte[] columnBlock(String column, Object sample, List<Object> values) {
        BinaryType named = BinaryType.fromColumnName(column).orElse(BinaryType.FLOAT32);
        if (sample instanceof String) {
            return BinaryBlocks.strings(values);
        }
        if (sample instanceof Collection<?>) {
            List<byte[]> perRow = new ArrayList<>(values.size());
            for (Object v : values) {
                List<?> elements = v instanceof Collection<?> c ? new ArrayList<>(c) : List.of();
                perRow.add(BinaryBlocks.numbers(named, elements));
            }
            return BinaryBlocks.buffer(perRow);
        }
        return BinaryBlocks.numbers(named, values);
    }
}
