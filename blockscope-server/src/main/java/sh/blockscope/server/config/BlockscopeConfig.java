// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.server.config;

import java.time.Duration;

import org.jspecify.annotations.Nullable;

/**
 * Service configuration as read from YAML.
 *
 * <pre>{@code
 * rpc:
 *   url: http://127.0.0.1:8332
 *   user: bitcoin
 *   pass: secret
 * server:
 *   host: 0.0.0.0
 *   port: 8080
 * }</pre>
 *
 * Optional sections and keys may be absent; {@link ConfigLoader} applies defaults.
 */
public record BlockscopeConfig(
        Rpc rpc,
        Server server,
        @Nullable Aggregator aggregator,
        @Nullable Debug debug) {

    public int parallelism() {
        return aggregator == null || aggregator.parallelism() == null ? 1 : aggregator.parallelism();
    }

    public boolean rpcDebug() {
        return debug != null && Boolean.TRUE.equals(debug.rpc());
    }

    public boolean httpDebug() {
        return debug != null && Boolean.TRUE.equals(debug.http());
    }

    public record Rpc(
            String url,
            String user,
            String pass,
            @Nullable Long connectTimeoutMillis,
            @Nullable Long readTimeoutMillis) {

        public @Nullable Duration connectTimeout() {
            return connectTimeoutMillis == null ? null : Duration.ofMillis(connectTimeoutMillis);
        }

        public @Nullable Duration readTimeout() {
            return readTimeoutMillis == null ? null : Duration.ofMillis(readTimeoutMillis);
        }

        @Override
        public String toString() {
            return "Rpc[url=" + url + ", user=" + user + ", pass=***]";
        }
    }

    public record Server(String host, Integer port) {}

    public record Aggregator(@Nullable Integer parallelism) {}

    public record Debug(@Nullable Boolean rpc, @Nullable Boolean http) {}
}
