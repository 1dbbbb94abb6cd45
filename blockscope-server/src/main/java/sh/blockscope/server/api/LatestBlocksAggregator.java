// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.server.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.blockscope.core.DebugLogger;
import sh.blockscope.core.LogFormatter;
import sh.blockscope.core.error.ApiException;
import sh.blockscope.core.error.RpcException;
import sh.blockscope.core.model.Block;
import sh.blockscope.core.model.LatestBlocks;
import sh.blockscope.core.types.BlockHash;
import sh.blockscope.core.types.BlockHeight;
import sh.blockscope.rpc.NodeReader;

/**
 * Collects the {@link LatestBlocks#WINDOW} most recent blocks.
 *
 * <p>
 * The chain height is read exactly once. Every later lookup is by height below that
 * read, so a tip that advances mid-request still yields a contiguous window as of
 * the first read. Any failure fails the whole request; partial lists are never
 * returned.
 *
 * <p>
 * With an executor the per-height lookups run concurrently; the result is ordered by
 * descending height regardless of completion order.
 */
public final class LatestBlocksAggregator {

    private static final Logger log = LoggerFactory.getLogger(LatestBlocksAggregator.class);

    public static final String FETCH_FAILED = "Failed to retrieve latest blocks";

    private final NodeReader reader;
    private final BlockResolver blocks;
    private final @Nullable ExecutorService executor;

    /**
     * Creates a sequential aggregator.
     */
    public LatestBlocksAggregator(final NodeReader reader, final BlockResolver blocks) {
        this(reader, blocks, null);
    }

    /**
     * @param executor runs the per-height lookups; {@code null} for sequential. Not
     *                 owned: the caller shuts it down.
     */
    public LatestBlocksAggregator(
            final NodeReader reader, final BlockResolver blocks, final @Nullable ExecutorService executor) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.blocks = Objects.requireNonNull(blocks, "blocks");
        this.executor = executor;
    }

    public LatestBlocks list() throws ApiException {
        final long start = System.nanoTime();
        try {
            final BlockHeight tip = reader.getBlockCount();
            final int count = LatestBlocks.expectedSize(tip);
            final List<Block> collected = executor == null ? sequential(tip, count) : fanOut(tip, count);
            final LatestBlocks latest = new LatestBlocks(tip, collected);
            DebugLogger.log(LogFormatter.formatLatestBlocks(
                    tip.value(), latest.size(), (System.nanoTime() - start) / 1_000L));
            return latest;
        } catch (RpcException e) {
            throw ApiException.upstream(FETCH_FAILED, e);
        }
    }

    private List<Block> sequential(final BlockHeight tip, final int count) {
        final List<Block> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(blockAt(tip.minus(i)));
        }
        return result;
    }

    private List<Block> fanOut(final BlockHeight tip, final int count) {
        final List<Future<Block>> pending = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final BlockHeight height = tip.minus(i);
            pending.add(executor.submit(() -> blockAt(height)));
        }

        final List<Block> result = new ArrayList<>(count);
        try {
            for (Future<Block> future : pending) {
                result.add(future.get());
            }
            return result;
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RpcException rpc) {
                throw rpc;
            }
            log.error("Unexpected failure fetching latest blocks below {}", tip, cause);
            throw ApiException.upstream(FETCH_FAILED, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ApiException.upstream(FETCH_FAILED, e);
        } finally {
            for (Future<Block> future : pending) {
                future.cancel(true);
            }
        }
    }

    private Block blockAt(final BlockHeight height) {
        final BlockHash hash = reader.getBlockHash(height);
        final Block block = blocks.fetch(hash);
        if (block.height() != height.value()) {
            throw RpcException.decode(
                    "block " + hash + " reports height " + block.height() + ", expected " + height, null, null, null);
        }
        return block;
    }
}
