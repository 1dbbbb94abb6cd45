// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.server.http;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Netty HTTP/1.1 server in front of an {@link ExplorerRouter}.
 *
 * <pre>{@code
 * try (BlockscopeHttpServer server = new BlockscopeHttpServer("127.0.0.1", 0, router)) {
 *     server.start();
 *     int port = server.port();
 * }
 * }</pre>
 */
public final class BlockscopeHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BlockscopeHttpServer.class);

    /** Threads running resolver work; each blocks on one node call at a time. */
    public static final int DEFAULT_HANDLER_THREADS = 16;

    /** Requests carry no body worth reading. */
    private static final int MAX_CONTENT_LENGTH = 64 * 1024;

    private final String host;
    private final int requestedPort;
    private final ExplorerRouter router;
    private final int handlerThreads;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel channel;

    public BlockscopeHttpServer(final String host, final int port, final ExplorerRouter router) {
        this(host, port, router, DEFAULT_HANDLER_THREADS);
    }

    public BlockscopeHttpServer(
            final String host, final int port, final ExplorerRouter router, final int handlerThreads) {
        if (handlerThreads < 1) {
            throw new IllegalArgumentException("handlerThreads must be at least 1, got: " + handlerThreads);
        }
        this.host = Objects.requireNonNull(host, "host");
        this.requestedPort = port;
        this.router = Objects.requireNonNull(router, "router");
        this.handlerThreads = handlerThreads;
    }

    /**
     * Binds and starts accepting connections.
     *
     * @throws InterruptedException if interrupted while binding
     * @throws IllegalStateException if already started
     */
    public synchronized void start() throws InterruptedException {
        if (channel != null) {
            throw new IllegalStateException("Server already started");
        }
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("blockscope-boss", true));
        workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("blockscope-io", true));
        handlerGroup = new DefaultEventExecutorGroup(
                handlerThreads, new DefaultThreadFactory("blockscope-handler", true));

        final ExplorerChannelHandler handler = new ExplorerChannelHandler(router);
        final ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 1024)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                        p.addLast(handlerGroup, "explorer", handler);
                    }
                });

        try {
            channel = bootstrap.bind(host, requestedPort).sync().channel();
        } catch (Exception e) {
            shutdownGroups();
            throw e;
        }
        log.info("Blockscope listening on http://{}:{}", host, port());
    }

    /**
     * @return the bound port, useful when started with port 0
     * @throws IllegalStateException if not started
     */
    public int port() {
        if (channel == null) {
            throw new IllegalStateException("Server not started");
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    /**
     * Blocks until the server channel is closed by {@link #close()}.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitClose() throws InterruptedException {
        final Channel bound;
        synchronized (this) {
            bound = channel;
        }
        if (bound != null) {
            bound.closeFuture().sync();
        }
    }

    @Override
    public synchronized void close() {
        if (channel == null) {
            return;
        }
        log.info("Stopping Blockscope HTTP server");
        channel.close().syncUninterruptibly();
        channel = null;
        shutdownGroups();
    }

    private void shutdownGroups() {
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        handlerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }
}
