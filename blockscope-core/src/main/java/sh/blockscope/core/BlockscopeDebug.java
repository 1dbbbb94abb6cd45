// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core;

/**
 * Global toggle for verbose debug logging across Blockscope modules.
 */
public final class BlockscopeDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean httpLogging = false;

    private BlockscopeDebug() {
    }

    public static boolean isEnabled() {
        return rpcLogging || httpLogging;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setHttpLogging(final boolean enabled) {
        httpLogging = enabled;
    }

    public static boolean isHttpLoggingEnabled() {
        return httpLogging;
    }
}
