// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.rpc;

import java.util.List;

import sh.blockscope.core.error.RpcException;

/**
 * Low-level abstraction for sending JSON-RPC requests to a Bitcoin node.
 *
 * <p>
 * Implementations serialize the request, send it over the wire, decode the
 * response envelope and classify failures into {@link RpcException.Kind}s.
 * They never retry.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe.
 *
 * @see HttpBitcoinProvider
 * @see NodeReader
 */
public interface BitcoinProvider extends AutoCloseable {

    /**
     * Sends a JSON-RPC request.
     *
     * @param method the JSON-RPC method name, e.g. {@code getblockcount}
     * @param params positional parameters
     * @return the JSON-RPC response, never carrying an error object
     * @throws RpcException if the request fails or the node returns an error
     */
    JsonRpcResponse send(String method, List<?> params) throws RpcException;

    /**
     * Releases resources held by this provider. The default does nothing.
     */
    @Override
    default void close() {
    }
}
