package decentralabs.attendance.util;

import java.util.regex.Pattern;

/**
 * Keeps caller supplied values (attendee identities, token ids, scanned payloads) safe for logs:
 * control characters are replaced to prevent log injection, and identifiers can be masked so
 * audit lines never contain a token that could still be replayed.
 */
public final class LogSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}]+");
    private static final int MAX_LENGTH = 256;

    private LogSanitizer() {
    }

    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("_");
        return cleaned.length() > MAX_LENGTH ? cleaned.substring(0, MAX_LENGTH) + "..." : cleaned;
    }

    /**
     * Short masked form keeping a prefix and suffix for correlation.
     */
    public static String maskIdentifier(String identifier) {
        String sanitized = sanitize(identifier);
        int length = sanitized.length();
        if (length == 0) {
            return "";
        }
        if (length <= 2) {
            return "*".repeat(length);
        }
        if (length <= 6) {
            return sanitized.charAt(0) + "***";
        }
        int keep = Math.min(4, length / 4);
        return sanitized.substring(0, keep) + "..." + sanitized.substring(length - keep);
    }
}
