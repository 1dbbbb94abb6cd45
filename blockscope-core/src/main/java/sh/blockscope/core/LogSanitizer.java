// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts HTTP basic-auth headers and node RPC passwords</li>
 * <li>Truncates excessively long logs (raw transactions can be megabytes)</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final String REDACTED = "***[REDACTED]***";

    private static final Pattern AUTHORIZATION =
            Pattern.compile("(?i)(authorization\\s*[:=]\\s*\"?basic\\s+)[A-Za-z0-9+/=]+");

    private static final Pattern PASSWORD =
            Pattern.compile("(?i)(\"?(?:pass|password|rpcpassword)\"?\\s*[:=]\\s*\"?)[^\",}\\s]+");

    private static final Pattern URL_CREDENTIALS =
            Pattern.compile("(://[^/:@\\s]+:)[^@/\\s]+(@)");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        sanitized = AUTHORIZATION.matcher(sanitized).replaceAll("$1" + REDACTED);
        sanitized = PASSWORD.matcher(sanitized).replaceAll("$1" + REDACTED);
        sanitized = URL_CREDENTIALS.matcher(sanitized).replaceAll("$1" + REDACTED + "$2");

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
