// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a JSON-RPC request to the Bitcoin node fails.
 *
 * <p>
 * Every failure is classified by {@link #kind()}:
 * <ul>
 * <li>{@link Kind#TRANSPORT}: connection refused, timeout, DNS failure, or a non-2xx
 * HTTP status ({@link #httpStatus()} is set for the latter)</li>
 * <li>{@link Kind#DECODE}: the body was not valid JSON-RPC, or the result could
 * not be mapped</li>
 * <li>{@link Kind#NODE_REJECTED}: the node answered with a JSON-RPC error object,
 * e.g. {@code -5 Block not found}</li>
 * </ul>
 *
 * <p>
 * <strong>Common Bitcoin Core error codes:</strong>
 * <ul>
 * <li><strong>-1</strong>: misc error, often wrong parameter types</li>
 * <li><strong>-5</strong>: invalid address or key; unknown block or transaction</li>
 * <li><strong>-8</strong>: invalid parameter, e.g. block height out of range</li>
 * <li><strong>-28</strong>: node still warming up</li>
 * <li><strong>-32601</strong>: method not found</li>
 * </ul>
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      Error Specification</a>
 */
public final class RpcException extends BlockscopeException {

    /** Code used for transport failures that never produced a JSON-RPC error. */
    public static final int TRANSPORT_ERROR = -32000;

    /** Code used for non-2xx HTTP responses. */
    public static final int HTTP_ERROR = -32001;

    /** JSON-RPC parse error code, used for bodies and results that cannot be decoded. */
    public static final int PARSE_ERROR = -32700;

    /** How a call to the node failed. */
    public enum Kind {
        TRANSPORT,
        DECODE,
        NODE_REJECTED
    }

    private final Kind kind;
    private final int code;
    private final @Nullable String data;
    private final @Nullable Long requestId;
    private final @Nullable Integer httpStatus;

    public RpcException(
            final Kind kind,
            final int code,
            final String message,
            final @Nullable String data,
            final @Nullable Long requestId,
            final @Nullable Integer httpStatus,
            final @Nullable Throwable cause) {
        super(augmentMessage(message, requestId), cause);
        this.kind = kind;
        this.code = code;
        this.data = data;
        this.requestId = requestId;
        this.httpStatus = httpStatus;
    }

    public static RpcException transport(
            final String message, final @Nullable Long requestId, final Throwable cause) {
        return new RpcException(Kind.TRANSPORT, TRANSPORT_ERROR, message, null, requestId, null, cause);
    }

    public static RpcException httpStatus(
            final int status, final String method, final @Nullable String body, final @Nullable Long requestId) {
        return new RpcException(
                Kind.TRANSPORT,
                HTTP_ERROR,
                "HTTP error for method " + method + ": " + status,
                body,
                requestId,
                status,
                null);
    }

    public static RpcException decode(
            final String message, final @Nullable String body, final @Nullable Long requestId,
            final @Nullable Throwable cause) {
        return new RpcException(Kind.DECODE, PARSE_ERROR, message, body, requestId, null, cause);
    }

    public static RpcException nodeRejected(
            final int code, final String message, final @Nullable String data, final @Nullable Long requestId) {
        return new RpcException(Kind.NODE_REJECTED, code, message, data, requestId, null, null);
    }

    /**
     * Creates an exception for a call that returned neither a result nor an error.
     *
     * @param method the RPC method name
     * @return a {@link Kind#DECODE} exception
     */
    public static RpcException fromNullResult(final String method) {
        return decode("RPC method " + method + " returned null result", null, null, null);
    }

    public Kind kind() {
        return kind;
    }

    public int code() {
        return code;
    }

    public @Nullable String data() {
        return data;
    }

    public @Nullable Long requestId() {
        return requestId;
    }

    public @Nullable Integer httpStatus() {
        return httpStatus;
    }

    public boolean isNodeRejected() {
        return kind == Kind.NODE_REJECTED;
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "kind="
                + kind
                + ", code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + ", requestId="
                + requestId
                + ", httpStatus="
                + httpStatus
                + "}";
    }

    private static String augmentMessage(final String message, final @Nullable Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }

        return "[requestId=" + requestId + "] " + message;
    }
}
