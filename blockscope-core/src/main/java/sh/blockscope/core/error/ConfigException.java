// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.error;

/**
 * Thrown when the service configuration is missing, unreadable or invalid.
 */
public final class ConfigException extends BlockscopeException {

    public ConfigException(final String message) {
        super(message);
    }

    public ConfigException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
