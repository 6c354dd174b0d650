package org.iceforge.sqlapi.format.binary;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Block type codes of the binary columnar container.
 */
public enum BinaryType {
    INT8(1, 1),
    UINT8(2, 1),
    UINTCLAMP8(3, 1),
    INT16(4, 2),
    UINT16(5, 2),
    UINTCLAMP16(6, 2),
    INT32(7, 4),
    UINT32(8, 4),
    UINTCLAMP32(9, 4),
    FLOAT32(10, 4),
    STRING(11, 0),
    BUFFER(12, 0);

    // e.g. "speed__uint16", "values__float32"
    private static final Pattern NAME_SUFFIX =
            Pattern.compile(".*__(uintclamp|uint|int|float)(8|16|32)", Pattern.CASE_INSENSITIVE);

    private final int code;
    private final int width;

    BinaryType(int code, int width) {
        this.code = code;
        this.width = width;
    }

    public int code() {
        return code;
    }

    /** Bytes per element for numeric types, 0 for variable-size types. */
    public int width() {
        return width;
    }

    public boolean numeric() {
        return width > 0;
    }

    /**
     * Type named by a column suffix such as {@code __int8}. Empty when there is no suffix or it
     * names no type ({@code __float8}, {@code __uintclamp64}).
     */
    public static Optional<BinaryType> fromColumnName(String name) {
        if (name == null) return Optional.empty();
        Matcher m = NAME_SUFFIX.matcher(name);
        if (!m.find()) return Optional.empty();
        String wanted = (m.group(1) + m.group(2)).toUpperCase(Locale.ROOT);
        for (BinaryType t : values()) {
            if (t.numeric() && t.name().equals(wanted)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
