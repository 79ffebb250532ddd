package dev.mcpproxy.relay;

import java.nio.charset.StandardCharsets;

/**
 * Helpers for logging payloads without dumping them whole.
 */
public final class Payloads {

    public static final int DEFAULT_PREVIEW_LENGTH = 100;

    private Payloads() {
    }

    public static String preview(String value, int max) {
        if (value == null) {
            return null;
        }
        int limit = Math.max(max, 0);
        if (value.length() <= limit) {
            return value;
        }
        return value.substring(0, limit) + "...";
    }

    public static String preview(byte[] value) {
        return "[binary " + (value == null ? 0 : value.length) + " bytes]";
    }

    public static String decode(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }
}
