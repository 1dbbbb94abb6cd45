// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings for {@link HttpBitcoinProvider}.
 *
 * @param url            the node's RPC endpoint
 * @param user           RPC user name
 * @param pass           RPC password; never printed
 * @param connectTimeout connect timeout, defaults to 10 seconds
 * @param readTimeout    per-request timeout, defaults to 30 seconds
 * @param headers        extra headers sent on every request
 */
public record RpcConfig(
        String url,
        String user,
        String pass,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers) {

    static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    static final Duration DEFAULT_READ = Duration.ofSeconds(30);

    public RpcConfig {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(pass, "pass");
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    @Override
    public String toString() {
        return "RpcConfig[url=" + url
                + ", user=" + user
                + ", pass=***"
                + ", connectTimeout=" + connectTimeout
                + ", readTimeout=" + readTimeout
                + ", headers=" + headers.keySet() + "]";
    }
}
