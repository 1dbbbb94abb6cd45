// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.error;

import java.util.Objects;

/**
 * An API request failed.
 *
 * <p>The message is the fixed, client-facing text for the endpoint and is safe to
 * return verbatim. Node details stay in the {@linkplain #getCause() cause}, which is
 * for logging only.
 */
public final class ApiException extends BlockscopeException {

    private final ApiError error;

    public ApiException(final ApiError error, final String message, final Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public ApiException(final ApiError error, final String message) {
        this(error, message, null);
    }

    public static ApiException invalidInput(final String message) {
        return new ApiException(ApiError.INVALID_INPUT, message);
    }

    public static ApiException upstream(final String message, final Throwable cause) {
        return new ApiException(ApiError.UPSTREAM, message, cause);
    }

    /**
     * Maps a node failure onto the API taxonomy.
     *
     * @param cause   the node failure
     * @param message the endpoint's fixed client-facing message
     * @return {@link ApiError#NOT_FOUND_OR_UPSTREAM} for node rejections,
     *         {@link ApiError#UPSTREAM} for transport and decode failures
     */
    public static ApiException fromRpc(final RpcException cause, final String message) {
        final ApiError error = cause.isNodeRejected() ? ApiError.NOT_FOUND_OR_UPSTREAM : ApiError.UPSTREAM;
        return new ApiException(error, message, cause);
    }

    public ApiError error() {
        return error;
    }

    public int httpStatus() {
        return error.httpStatus();
    }
}
