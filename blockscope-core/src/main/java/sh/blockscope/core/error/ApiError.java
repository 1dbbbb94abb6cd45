// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.error;

/**
 * API-level failure categories and the HTTP status each one surfaces as.
 */
public enum ApiError {
    /** Malformed client-supplied identifier. */
    INVALID_INPUT(400),
    /** The node rejected the request, most often because the identifier is unknown. */
    NOT_FOUND_OR_UPSTREAM(500),
    /** The node could not be reached or its answer could not be decoded. */
    UPSTREAM(500);

    private final int httpStatus;

    ApiError(final int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
