package org.iceforge.sqlapi.tables;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * SHA-256 of the raw statement text. Used as a cache key only.
 * <p>
 * No normalization: two statements that differ in whitespace are different keys.
 */
public final class StatementFingerprint {
    private StatementFingerprint() {}

    public static String of(String sql) {
        Objects.requireNonNull(sql, "sql");
        return sha256Hex(sql);
    }

    private static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(dig.length * 2);
            for (byte b : dig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
