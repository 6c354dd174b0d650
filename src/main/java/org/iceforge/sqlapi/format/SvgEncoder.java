package org.iceforge.sqlapi.format;

import org.iceforge.sqlapi.jdbc.TabularResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SVG drawing of the geometry column.
 * <p>
 * The rewritten statement translates and scales every geometry so the whole extent fits in
 * {@value #WIDTH}x{@value #HEIGHT}, and returns per row the scaled extent box, the geometry
 * dimension and its SVG path data. Points are drawn as circles, everything else as paths.
 */
public class SvgEncoder extends AbstractRowEncoder {

    static final int WIDTH = 1024;
    static final int HEIGHT = 768;
    static final int POINT_RADIUS = 5;
    static final int STROKE_WIDTH = 1;

    private static final Pattern BOX =
            Pattern.compile("BOX\\(\\s*(\\S+)\\s+(\\S+)\\s*,\\s*(\\S+)\\s+(\\S+)\\s*\\)", Pattern.CASE_INSENSITIVE);

    @Override
    public OutputFormat format() {
        return OutputFormat.SVG;
    }

    @Override
    public String contentType() {
        return "image/svg+xml; charset=utf-8";
    }

    @Override
    public String fileExtension() {
        return "svg";
    }

    @Override
    public String rewrite(String sql, EncodeOptions options) {
        String gn = options.geometryColumn();
        double ratio = (double) WIDTH / HEIGHT;
        return "WITH source AS ( " + sql + " ), "
                + "extent AS ( SELECT ST_Extent(" + gn + ") AS e FROM source ), "
                + "extent_info AS ( SELECT e, st_xmin(e) as ex0, st_ymax(e) as ey0, "
                + "st_xmax(e)-st_xmin(e) as ew, st_ymax(e)-st_ymin(e) as eh FROM extent ), "
                + "trans AS ( SELECT CASE WHEN eh = 0 THEN " + WIDTH + "/ COALESCE(NULLIF(ew,0)," + WIDTH + ") "
                + "WHEN " + ratio + " <= (ew / eh) THEN (" + WIDTH + "/ew ) "
                + "ELSE (" + HEIGHT + "/eh ) END as s, ex0 as x0, ey0 as y0 FROM extent_info ) "
                + "SELECT st_TransScale(e, -x0, -y0, s, s)::box2d as " + gn + "_box, "
                + "ST_Dimension(" + gn + ") as " + gn + "_dimension, "
                + "ST_AsSVG(ST_TransScale(" + gn + ", -x0, -y0, s, s), 0, " + options.decimalPrecision() + ") as " + gn
                + " FROM trans, extent_info, source"
                + " ORDER BY " + gn + "_dimension ASC";
    }

    @Override
    public void render(TabularResult result, EncodeOptions options, OutputStream out) throws IOException {
        String gn = options.geometryColumn();
        StringBuilder shapes = new StringBuilder();
        double[] box = null;
        for (Map<String, Object> row : result.rows()) {
            Object svg = row.get(gn);
            if (svg == null || svg.toString().isEmpty()) continue;
            if (box == null) box = parseBox(row.get(gn + "_box"));
            int dimension = dimensionOf(row.get(gn + "_dimension"));
            if (dimension == 0) {
                shapes.append("<circle r=\"").append(POINT_RADIUS).append("\" ").append(svg).append(" />\n");
            } else {
                shapes.append("<path d=\"").append(svg).append("\" />\n");
            }
        }

        Writer w = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        w.write("<?xml version=\"1.0\" standalone=\"no\"?>\n");
        w.write("<!DOCTYPE svg PUBLIC \"-//W3C//DTD SVG 1.1//EN\" \"http://www.w3.org/Graphics/SVG/1.1/DTD/svg11.dtd\">\n");
        w.write("<svg xmlns=\"http://www.w3.org/2000/svg\" version=\"1.1\"");
        if (box != null) {
            // ST_AsSVG flips y, so the top edge is -ymax
            double pad = POINT_RADIUS + STROKE_WIDTH;
            double width = box[2] - box[0];
            double height = box[3] - box[1];
            w.write(" width=\"" + num(width + 2 * pad) + "\" height=\"" + num(height + 2 * pad) + "\"");
            w.write(" viewBox=\"" + num(box[0] - pad) + " " + num(-box[3] - pad) + " "
                    + num(width + 2 * pad) + " " + num(height + 2 * pad) + "\"");
        } else {
            w.write(" width=\"" + WIDTH + "\" height=\"" + HEIGHT + "\"");
        }
        w.write(">\n");
        w.write("<g stroke=\"black\" stroke-width=\"" + STROKE_WIDTH + "\" fill=\"none\">\n");
        w.write(shapes.toString());
        w.write("</g>\n</svg>\n");
        w.flush();
    }

    static double[] parseBox(Object value) {
        if (value == null) return null;
        Matcher m = BOX.matcher(value.toString());
        if (!m.find()) return null;
        try {
            return new double[]{
                    Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2)),
                    Double.parseDouble(m.group(3)), Double.parseDouble(m.group(4))};
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int dimensionOf(Object value) {
        if (value instanceof Number n) return n.intValue();
        if (value == null) return -1;
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String num(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d)) return Long.toString((long) d);
        return Double.toString(d);
    }
}
