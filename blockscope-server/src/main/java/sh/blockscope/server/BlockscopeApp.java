// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.server;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.blockscope.core.BlockscopeDebug;
import sh.blockscope.core.LogSanitizer;
import sh.blockscope.core.error.ConfigException;
import sh.blockscope.rpc.BitcoinProvider;
import sh.blockscope.rpc.HttpBitcoinProvider;
import sh.blockscope.rpc.NodeReader;
import sh.blockscope.server.api.BlockResolver;
import sh.blockscope.server.api.LatestBlocksAggregator;
import sh.blockscope.server.api.TransactionResolver;
import sh.blockscope.server.config.BlockscopeConfig;
import sh.blockscope.server.config.ConfigLoader;
import sh.blockscope.server.http.BlockscopeHttpServer;
import sh.blockscope.server.http.ExplorerRouter;

/**
 * Wires configuration, node client and HTTP server together.
 *
 * <p>Usage: {@code java -jar blockscope-server.jar [config.yaml]}
 */
public final class BlockscopeApp implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BlockscopeApp.class);

    private final BitcoinProvider provider;
    private final @Nullable ExecutorService fetchExecutor;
    private final BlockscopeHttpServer server;

    public BlockscopeApp(final BlockscopeConfig config) {
        final BlockscopeConfig.Rpc rpc = config.rpc();
        this.provider = HttpBitcoinProvider.builder(rpc.url())
                .credentials(rpc.user(), rpc.pass())
                .connectTimeout(rpc.connectTimeout())
                .readTimeout(rpc.readTimeout())
                .build();
        this.fetchExecutor = config.parallelism() > 1
                ? BlockscopeExecutors.newFetchExecutor(config.parallelism())
                : null;

        final NodeReader reader = NodeReader.from(provider);
        final BlockResolver blocks = new BlockResolver(reader);
        final ExplorerRouter router = new ExplorerRouter(
                blocks,
                new TransactionResolver(reader),
                new LatestBlocksAggregator(reader, blocks, fetchExecutor));
        this.server = new BlockscopeHttpServer(config.server().host(), config.server().port(), router);
    }

    public void start() throws InterruptedException {
        server.start();
    }

    public int port() {
        return server.port();
    }

    public void awaitClose() throws InterruptedException {
        server.awaitClose();
    }

    @Override
    public void close() {
        server.close();
        if (fetchExecutor != null) {
            fetchExecutor.shutdownNow();
            try {
                fetchExecutor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        provider.close();
    }

    public static void main(final String[] args) {
        final Path path = ConfigLoader.resolvePath(args, System.getenv());
        final BlockscopeConfig config;
        try {
            config = ConfigLoader.load(path);
        } catch (ConfigException e) {
            log.error("Cannot start: {}", e.getMessage());
            System.exit(1);
            return;
        }
        BlockscopeDebug.setRpcLogging(config.rpcDebug());
        BlockscopeDebug.setHttpLogging(config.httpDebug());
        log.info("Using node {} (aggregator parallelism {})", LogSanitizer.sanitize(config.rpc().url()), config.parallelism());

        final BlockscopeApp app = new BlockscopeApp(config);
        Runtime.getRuntime().addShutdownHook(new Thread(app::close, "blockscope-shutdown"));
        try {
            app.start();
            app.awaitClose();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            app.close();
        } catch (Exception e) {
            log.error("Server failed", e);
            app.close();
            System.exit(1);
        }
    }
}
