// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.server.http;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A transport-neutral HTTP answer produced by {@link ExplorerRouter}.
 *
 * <p>The reply owns {@code body}: callers hand over a fresh array and never mutate it
 * afterwards. Equality compares the body's contents.
 *
 * @param status      HTTP status code
 * @param contentType value of the {@code Content-Type} header
 * @param body        response body
 */
record HttpReply(int status, String contentType, byte[] body) {

    static final String JSON = "application/json";
    static final String TEXT = "text/plain; charset=UTF-8";

    HttpReply {
        Objects.requireNonNull(contentType, "contentType");
        Objects.requireNonNull(body, "body");
    }

    static HttpReply json(final byte[] body) {
        return new HttpReply(200, JSON, body);
    }

    static HttpReply text(final int status, final String message) {
        return new HttpReply(status, TEXT, message.getBytes(StandardCharsets.UTF_8));
    }

    String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HttpReply)) {
            return false;
        }
        final HttpReply other = (HttpReply) o;
        return status == other.status && contentType.equals(other.contentType) && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(status, contentType) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "HttpReply[status=" + status + ", contentType=" + contentType + ", body=" + body.length + " bytes]";
    }
}
