// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * Represents a JSON-RPC response from a Bitcoin node.
 * <p>
 * Holds either a result or an error. Bitcoin Core always sends both members and
 * sets the unused one to {@code null}, so use {@link #hasError()} to tell them apart.
 *
 * @param jsonrpc the JSON-RPC version; older nodes send {@code "1.0"} or omit it
 * @param result the result if successful, or {@code null}
 * @param error the error object if failed, or {@code null}
 * @param id the request ID this response answers
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        @Nullable String jsonrpc,
        @Nullable Object result,
        @Nullable JsonRpcError error,
        @Nullable String id) {

    public boolean hasError() {
        return error != null;
    }
}
