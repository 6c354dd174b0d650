package org.iceforge.sqlapi.tables;

/**
 * Embeds arbitrary text in a PostgreSQL dollar-quoted literal.
 * The tag is chosen so it does not occur in the text, so the text cannot close the literal.
 */
final class DollarQuote {
    static final String DEFAULT_TAG = "quotesql";

    private DollarQuote() {}

    static String quote(String text) {
        String tag = DEFAULT_TAG;
        int n = 0;
        while (text.contains("$" + tag + "$")) {
            tag = DEFAULT_TAG + "_" + (++n);
        }
        return "$" + tag + "$" + text + "$" + tag + "$";
    }
}
