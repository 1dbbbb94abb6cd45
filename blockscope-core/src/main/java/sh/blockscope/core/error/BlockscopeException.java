// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.error;

/**
 * Base runtime exception for all Blockscope failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * BlockscopeException
 * ├── {@link RpcException} - talking to the node failed (transport, decode, node rejection)
 * ├── {@link ApiException} - an API request failed; carries the HTTP status and fixed message
 * └── {@link ConfigException} - configuration could not be loaded
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     Block block = blockResolver.resolve(rawHash);
 * } catch (ApiException e) {
 *     respond(e.httpStatus(), e.getMessage());
 * }
 * }</pre>
 */
public sealed class BlockscopeException extends RuntimeException
        permits RpcException,
        ApiException,
        ConfigException {

    public BlockscopeException(final String message) {
        super(message);
    }

    public BlockscopeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
