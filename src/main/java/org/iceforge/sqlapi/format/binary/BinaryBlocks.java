package org.iceforge.sqlapi.format.binary;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

/**
 * Builds length-prefixed blocks: type code (uint32), payload length in bytes (uint32), payload.
 * Everything is little-endian.
 */
public final class BinaryBlocks {

    static final int HEADER_SIZE = 8;

    private BinaryBlocks() {}

    /** STRING block: string count, then per string its UTF-16 length and code units. */
    public static byte[] strings(List<?> values) {
        int size = 4;
        String[] strings = new String[values.size()];
        for (int i = 0; i < strings.length; i++) {
            Object v = values.get(i);
            strings[i] = v == null ? "" : v.toString();
            size += 4 + strings[i].length() * 2;
        }
        ByteBuffer buf = allocate(BinaryType.STRING, size);
        buf.putInt(strings.length);
        for (String s : strings) {
            buf.putInt(s.length());
            for (int i = 0; i < s.length(); i++) {
                buf.putChar(s.charAt(i));
            }
        }
        return buf.array();
    }

    /** Numeric block, one element per value. */
    public static byte[] numbers(BinaryType type, List<?> values) {
        if (!type.numeric()) {
            throw new IllegalArgumentException("Not a numeric block type: " + type);
        }
        ByteBuffer buf = allocate(type, values.size() * type.width());
        for (Object v : values) {
            putNumber(buf, type, v);
        }
        return buf.array();
    }

    /** BUFFER block holding already encoded blocks back to back. */
    public static byte[] buffer(List<byte[]> blocks) {
        int size = 0;
        for (byte[] b : blocks) size += b.length;
        ByteBuffer buf = allocate(BinaryType.BUFFER, size);
        for (byte[] b : blocks) buf.put(b);
        return buf.array();
    }

    private static ByteBuffer allocate(BinaryType type, int payloadSize) {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE + payloadSize).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(type.code());
        buf.putInt(payloadSize);
        return buf;
    }

    private static void putNumber(ByteBuffer buf, BinaryType type, Object value) {
        double d = toDouble(value);
        switch (type) {
            case FLOAT32 -> buf.putFloat((float) d);
            case INT8, UINT8 -> buf.put((byte) toLong(d));
            case UINTCLAMP8 -> buf.put((byte) clamp(d, 0xFF));
            case INT16, UINT16 -> buf.putShort((short) toLong(d));
            case UINTCLAMP16 -> buf.putShort((short) clamp(d, 0xFFFF));
            case INT32, UINT32 -> buf.putInt((int) toLong(d));
            case UINTCLAMP32 -> buf.putInt((int) clamp(d, 0xFFFF_FFFFL));
            default -> throw new IllegalArgumentException("Not a numeric block type: " + type);
        }
    }

    private static double toDouble(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof Boolean b) return b ? 1 : 0;
        if (value == null) return Double.NaN;
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static long toLong(double d) {
        return Double.isNaN(d) ? 0L : (long) d;
    }

    private static long clamp(double d, long max) {
        if (Double.isNaN(d) || d <= 0) return 0L;
        if (d >= max) return max;
        return Math.round(d);
    }
}
