// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core;

import static sh.blockscope.core.AnsiColors.*;

import java.util.Locale;

/**
 * Log formatter for Blockscope debug output.
 *
 * <p>
 * Every line uses a bracketed {@code [OPERATION]} tag, shortened hashes
 * ({@code 00000000...e26f}) and human-readable durations. Status symbols (✓ ✗)
 * mark success and failure.
 *
 * <pre>{@code
 * DebugLogger.logRpc(LogFormatter.formatRpc("getblockcount", 1060));
 * // [RPC] method=getblockcount duration=1.06ms
 *
 * DebugLogger.logRpc(LogFormatter.formatRpcError("getblock", -5, "Block not found", 870));
 * // ✗ [RPC-ERROR] method=getblock code=-5 message=Block not found duration=0.87ms
 *
 * DebugLogger.logHttp(LogFormatter.formatHttp("GET", "/latest_blocks", 200, 35210));
 * // ✓ [HTTP] GET /latest_blocks status=200 duration=35.21ms
 * }</pre>
 *
 * <p>
 * All methods are thread-safe and free of side effects.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    /** Characters kept at the start of a shortened hash. */
    private static final int HASH_PREFIX_LENGTH = 8;

    /** Characters kept at the end of a shortened hash. */
    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH + 3;

    private LogFormatter() {
    }

    /**
     * Format: [RPC] method=getblock duration=1.06ms
     */
    public static String formatRpc(String method, long durationMicros) {
        return String.format(
                "%s[RPC]%s method=%s %s",
                INDIGO, RESET,
                method,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [RPC-ERROR] method=getblock code=-5 message=Block not found duration=1.5ms
     */
    public static String formatRpcError(String method, Object code, String message, long durationMicros) {
        return String.format(
                "%s✗%s %s[RPC-ERROR]%s method=%s code=%s message=%s %s",
                CORAL, RESET,
                CORAL, RESET,
                method,
                code,
                CORAL + message + RESET,
                duration(durationMicros));
    }

    /**
     * Format: ✓ [HTTP] GET /block/0000...e26f status=200 duration=3.20ms
     */
    public static String formatHttp(String method, String path, int status, long durationMicros) {
        final boolean ok = status < 400;
        return String.format(
                "%s%s%s %s[HTTP]%s %s %s status=%d %s",
                ok ? TEAL : CORAL, ok ? "✓" : "✗", RESET,
                AMBER, RESET,
                method,
                shortenPath(path),
                status,
                duration(durationMicros));
    }

    /**
     * Format: [LATEST-BLOCKS] tip=105 count=10 duration=40.00ms
     */
    public static String formatLatestBlocks(long tipHeight, int count, long durationMicros) {
        return String.format(
                "%s[LATEST-BLOCKS]%s tip=%d count=%d %s",
                TEAL, RESET,
                tipHeight,
                count,
                duration(durationMicros));
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format(Locale.ROOT, "%.2fms", ms);
        } else {
            formatted = String.format(Locale.ROOT, "%.2fs", ms / 1000.0);
        }
        return SLATE + "duration=" + formatted + RESET;
    }

    private static String shortenPath(String path) {
        if (path == null) {
            return null;
        }
        final int slash = path.lastIndexOf('/');
        if (slash < 0) {
            return path;
        }
        return path.substring(0, slash + 1) + shortenHash(path.substring(slash + 1));
    }

    /**
     * Shortens a hash to a readable format: {@code 00000000...e26f}.
     *
     * @param fullHash the full hash string to shorten
     * @return the shortened hash, or the original if null or already short enough
     */
    static String shortenHash(String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
