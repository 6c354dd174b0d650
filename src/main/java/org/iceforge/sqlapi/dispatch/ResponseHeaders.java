package org.iceforge.sqlapi.dispatch;

import org.iceforge.sqlapi.tables.TableExtractionEntry;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Header values the dispatcher sets on successful responses.
 */
public final class ResponseHeaders {

    public static final String CACHE_CHANNEL = "X-Cache-Channel";
    public static final String NO_CACHE_CHANNEL = "NONE";

    static final String PERSISTENT_CACHE_CONTROL = "public,max-age=31536000";
    static final String DEFAULT_CACHE_CONTROL = "no-cache,max-age=3600,must-revalidate,public";

    private ResponseHeaders() {}

    public static String contentDisposition(boolean inline, String filename, String extension, ZonedDateTime now) {
        return (inline ? "inline" : "attachment") + "; filename=" + filename + "." + extension
                + "; modification-date=\"" + httpDate(now) + "\";";
    }

    /**
     * {@code NONE} when nothing is known about the tables, or when an authenticated caller may be
     * writing; {@code <database>:<tables>} otherwise.
     */
    public static String cacheChannel(String database, TableExtractionEntry entry, boolean authenticated) {
        if (entry == null || (authenticated && entry.mayWrite())) return NO_CACHE_CHANNEL;
        return database + ":" + entry.rawTables();
    }

    static String httpDate(ZonedDateTime time) {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(time.withZoneSameInstant(ZoneOffset.UTC));
    }
}
