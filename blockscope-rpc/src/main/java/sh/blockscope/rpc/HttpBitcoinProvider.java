// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.rpc;

import static sh.blockscope.rpc.internal.RpcUtils.MAPPER;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.blockscope.core.DebugLogger;
import sh.blockscope.core.LogFormatter;
import sh.blockscope.core.error.RpcException;
import sh.blockscope.rpc.internal.RpcUtils;

/**
 * {@link BitcoinProvider} over HTTP with basic authentication.
 *
 * <p>
 * Failure classification:
 * <ul>
 * <li>I/O failure or interruption: {@link RpcException.Kind#TRANSPORT}</li>
 * <li>non-2xx status: {@link RpcException.Kind#NODE_REJECTED} when the body is a
 * JSON-RPC error (Bitcoin Core answers {@code -5} with HTTP 404 or 500), otherwise
 * {@link RpcException.Kind#TRANSPORT} carrying the status</li>
 * <li>2xx with an error object: {@link RpcException.Kind#NODE_REJECTED}</li>
 * <li>unparseable body: {@link RpcException.Kind#DECODE}</li>
 * </ul>
 */
public final class HttpBitcoinProvider implements BitcoinProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpBitcoinProvider.class);

    private final RpcConfig config;
    private final HttpClient httpClient;
    private final String authorization;
    private final AtomicLong ids = new AtomicLong(1L);

    private HttpBitcoinProvider(final RpcConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString((config.user() + ":" + config.pass()).getBytes(StandardCharsets.UTF_8));
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public RpcConfig config() {
        return config;
    }

    @Override
    public JsonRpcResponse send(final String method, final List<?> params) throws RpcException {
        final List<?> safeParams = params == null ? List.of() : params;
        final long requestId = ids.getAndIncrement();
        final JsonRpcRequest request = new JsonRpcRequest("2.0", method, safeParams, String.valueOf(requestId));

        final String payload = serialize(request, requestId);
        final HttpRequest httpRequest = buildRequest(payload);

        final long start = System.nanoTime();
        final HttpResponse<String> response = execute(method, httpRequest, requestId, start);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;

        final int status = response.statusCode();
        final String responseBody = response.body();
        if (status < 200 || status >= 300) {
            final JsonRpcResponse rejected = tryParseError(responseBody);
            if (rejected != null) {
                throw rejected(method, rejected.error(), requestId, durationMicros);
            }
            DebugLogger.logRpc(LogFormatter.formatRpcError(method, status, "HTTP " + status, durationMicros));
            throw RpcException.httpStatus(status, method, responseBody, requestId);
        }

        final JsonRpcResponse rpcResponse = parseResponse(method, responseBody, requestId);
        if (rpcResponse.hasError()) {
            throw rejected(method, rpcResponse.error(), requestId, durationMicros);
        }

        DebugLogger.logRpc(LogFormatter.formatRpc(method, durationMicros));
        return rpcResponse;
    }

    private RpcException rejected(
            final String method, final JsonRpcError err, final long requestId, final long durationMicros) {
        DebugLogger.logRpc(LogFormatter.formatRpcError(method, err.code(), err.message(), durationMicros));
        return RpcException.nodeRejected(
                err.code(), err.message(), RpcUtils.extractErrorData(err.data()), requestId);
    }

    private String serialize(final JsonRpcRequest request, final long requestId) throws RpcException {
        try {
            return MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw RpcException.decode(
                    "Unable to serialize JSON-RPC request for " + request.method(), null, requestId, e);
        }
    }

    private HttpRequest buildRequest(final String payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.url()))
                .header("Content-Type", "application/json")
                .header("Authorization", authorization)
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload));

        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        return builder.build();
    }

    private HttpResponse<String> execute(
            final String method, final HttpRequest request, final long requestId, final long start)
            throws RpcException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw transportFailure(method, requestId, start, e);
        } catch (IOException e) {
            throw transportFailure(method, requestId, start, e);
        }
    }

    private RpcException transportFailure(
            final String method, final long requestId, final long start, final Exception cause) {
        final long durationMicros = (System.nanoTime() - start) / 1_000L;
        DebugLogger.logRpc(LogFormatter.formatRpcError(
                method, RpcException.TRANSPORT_ERROR, cause.getClass().getSimpleName(), durationMicros));
        return RpcException.transport("Network error during JSON-RPC call " + method, requestId, cause);
    }

    private JsonRpcResponse parseResponse(final String method, final String body, final long requestId)
            throws RpcException {
        final JsonRpcResponse parsed;
        try {
            parsed = MAPPER.readValue(body, JsonRpcResponse.class);
        } catch (JsonProcessingException e) {
            throw RpcException.decode(
                    "Unable to parse JSON-RPC response for method " + method, body, requestId, e);
        }
        if (parsed == null) {
            throw RpcException.decode("Empty JSON-RPC response for method " + method, body, requestId, null);
        }
        return parsed;
    }

    private static JsonRpcResponse tryParseError(final String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            final JsonRpcResponse parsed = MAPPER.readValue(body, JsonRpcResponse.class);
            return parsed != null && parsed.hasError() ? parsed : null;
        } catch (JsonProcessingException e) {
            log.debug("Non-2xx body is not a JSON-RPC envelope: {}", e.getOriginalMessage());
            return null;
        }
    }

    public static final class Builder {
        private final String url;
        private String user = "";
        private String pass = "";
        private Duration connectTimeout = RpcConfig.DEFAULT_CONNECT;
        private Duration readTimeout = RpcConfig.DEFAULT_READ;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = url;
        }

        public Builder credentials(final String user, final String pass) {
            this.user = user;
            this.pass = pass;
            return this;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public HttpBitcoinProvider build() {
            return new HttpBitcoinProvider(
                    new RpcConfig(url, user, pass, connectTimeout, readTimeout, new LinkedHashMap<>(headers)));
        }
    }
}
