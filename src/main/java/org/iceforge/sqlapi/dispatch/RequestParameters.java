package org.iceforge.sqlapi.dispatch;

import org.iceforge.sqlapi.error.ValidationException;
import org.iceforge.sqlapi.format.OutputFormat;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validated request parameters with defaults applied.
 *
 * @param limit  rows per page, null unless both paging parameters are numbers
 * @param offset page times rows per page, null unless both paging parameters are numbers
 */
public record RequestParameters(String sql,
                                String apiKey,
                                String database,
                                OutputFormat format,
                                boolean explicitFormatOrFilename,
                                String filename,
                                Set<String> skipFields,
                                int decimalPrecision,
                                Integer limit,
                                Long offset,
                                boolean persist) {

    public static final String DEFAULT_FILENAME = "cartodb-query";
    public static final int DEFAULT_DECIMAL_PRECISION = 6;

    private static final Pattern UNSAFE_FILENAME_CHARS = Pattern.compile("[;()\\[\\]<>'\"\\s]");

    public static RequestParameters parse(QueryRequest request) {
        String requestedFormat = emptyToNull(request.last("format"));
        String requestedFilename = emptyToNull(request.last("filename"));

        // format is checked before the statement
        String formatId = requestedFormat != null ? requestedFormat : emptyToNull(request.pathFormat());
        OutputFormat format = formatId == null ? OutputFormat.JSON : OutputFormat.fromId(formatId);

        String sql = emptyToNull(request.last("q"));
        if (sql == null) throw new ValidationException("You must indicate a sql query");

        Integer limit = parseIntOrNull(request.last("rows_per_page"));
        Integer page = parseIntOrNull(request.last("page"));
        Long offset = limit != null && page != null ? (long) page * limit : null;

        return new RequestParameters(
                sql,
                emptyToNull(request.last("api_key")),
                emptyToNull(request.last("database")),
                format,
                formatId != null || requestedFilename != null,
                requestedFilename == null ? DEFAULT_FILENAME : sanitizeFilename(requestedFilename),
                skipFields(request),
                decimalPrecision(request.last("dp")),
                offset == null ? null : limit,
                offset,
                "persist".equals(request.last("cache_policy")));
    }

    /**
     * Base name without directories or extension; characters unsafe in a header are replaced
     * with underscores.
     */
    public static String sanitizeFilename(String filename) {
        String name = filename;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) name = name.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot > 0) name = name.substring(0, dot);
        name = UNSAFE_FILENAME_CHARS.matcher(name).replaceAll("_");
        return name.isEmpty() ? DEFAULT_FILENAME : name;
    }

    static Set<String> skipFields(QueryRequest request) {
        Set<String> out = new LinkedHashSet<>();
        for (String value : request.values("skipfields")) {
            if (value == null) continue;
            for (String field : value.split(",")) {
                String f = field.trim();
                if (!f.isEmpty()) out.add(f);
            }
        }
        return out;
    }

    static int decimalPrecision(String dp) {
        if (dp == null || dp.isEmpty()) return DEFAULT_DECIMAL_PRECISION;
        try {
            int value = Integer.parseInt(dp.trim());
            if (value < 0) throw new ValidationException("Invalid dp: " + dp);
            return value;
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid dp: " + dp);
        }
    }

    private static Integer parseIntOrNull(String s) {
        if (s == null) return null;
        try {
            return Integer.valueOf(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
