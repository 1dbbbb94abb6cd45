// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for RPC and HTTP tracing.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.blockscope.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (!BlockscopeDebug.isRpcLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logHttp(final String message, final Object... args) {
        if (!BlockscopeDebug.isHttpLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!BlockscopeDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Direct output to stdout for colored logs in TTY environments.
     * Falls back to SLF4J for non-TTY environments.
     * Always sanitized so node credentials never reach the output.
     */
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);

        final String sanitized = LogSanitizer.sanitize(formatted);

        if (AnsiColors.IS_TTY) {
            System.out.println(sanitized);
        } else {
            LOG.info(sanitized);
        }
    }
}
