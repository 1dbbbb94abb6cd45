// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.rpc.internal;

import java.util.List;
import java.util.function.Function;

import sh.blockscope.core.error.RpcException;
import sh.blockscope.rpc.JsonRpcResponse;

/**
 * Internal helper that sends a request and decodes its result.
 *
 * <p>A {@code null} result and any decoder failure both surface as
 * {@link RpcException.Kind#DECODE}, so callers only ever see {@link RpcException}.
 */
public final class RpcInvoker {

    /**
     * Sends a JSON-RPC request and returns the response.
     */
    @FunctionalInterface
    public interface RpcSender {
        JsonRpcResponse send(String method, List<?> params);
    }

    private final RpcSender sender;

    public RpcInvoker(final RpcSender sender) {
        this.sender = sender;
    }

    /**
     * Invokes an RPC method and decodes the non-null result.
     *
     * @param method  the RPC method name
     * @param params  the method parameters
     * @param decoder converts the raw result (string, number, map or list) to {@code T}
     * @param <T>     the return type
     * @return the decoded result
     * @throws RpcException if the call fails, the result is null or cannot be decoded
     */
    public <T> T call(final String method, final List<?> params, final Function<Object, T> decoder) {
        final JsonRpcResponse response = sender.send(method, params);
        final Object result = response.result();
        if (result == null) {
            throw RpcException.fromNullResult(method);
        }
        try {
            return decoder.apply(result);
        } catch (IllegalArgumentException | ClassCastException e) {
            throw RpcException.decode(
                    "Unable to decode result of " + method + ": " + e.getMessage(),
                    RpcUtils.stringValue(result),
                    null,
                    e);
        }
    }

    /**
     * Invokes an RPC method and maps the result onto {@code type} with Jackson.
     */
    public <T> T call(final String method, final List<?> params, final Class<T> type) {
        return call(method, params, result -> RpcUtils.MAPPER.convertValue(result, type));
    }
}
