package tore.relay.util;

import java.util.regex.Pattern;

/**
 * Helpers to keep values received from the chain node or the downstream service safe for logging.
 */
public final class LogSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");
    private static final int MAX_LOGGED_LENGTH = 256;

    private LogSanitizer() {
        // Utility class
    }

    /**
     * Replaces control characters that could be abused for log injection.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("_");
    }

    /**
     * Sanitizes and caps the length of free-form text such as HTTP error bodies.
     */
    public static String truncate(String value) {
        String sanitized = sanitize(value);
        if (sanitized.length() <= MAX_LOGGED_LENGTH) {
            return sanitized;
        }
        return sanitized.substring(0, MAX_LOGGED_LENGTH) + "...";
    }

    /**
     * Shortens a transaction hash to {@code 0x1234ab...cdef} for compact log lines.
     */
    public static String shortHash(String hash) {
        String sanitized = sanitize(hash);
        if (sanitized.length() <= 14) {
            return sanitized;
        }
        return sanitized.substring(0, 8) + "..." + sanitized.substring(sanitized.length() - 4);
    }
}
