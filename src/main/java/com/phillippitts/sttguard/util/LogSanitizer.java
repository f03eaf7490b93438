package com.phillippitts.sttguard.util;

/** Utility for privacy-safe logging of client-supplied data. */
public final class LogSanitizer {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Hex dump of at most {@code maxBytes} leading bytes, e.g. {@code "0a000000 7b22"}.
     * Enough to diagnose a broken length prefix without logging audio.
     */
    public static String hexPreview(byte[] bytes, int maxBytes) {
        if (bytes == null || maxBytes <= 0) {
            return "";
        }
        int n = Math.min(bytes.length, maxBytes);
        StringBuilder sb = new StringBuilder(n * 2 + n / 4);
        for (int i = 0; i < n; i++) {
            if (i > 0 && i % 4 == 0) {
                sb.append(' ');
            }
            sb.append(HEX[(bytes[i] >> 4) & 0x0F]).append(HEX[bytes[i] & 0x0F]);
        }
        if (bytes.length > n) {
            sb.append("...");
        }
        return sb.toString();
    }
}
