// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.server.http;

import java.util.Objects;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.blockscope.core.error.ApiException;
import sh.blockscope.server.api.BlockResolver;
import sh.blockscope.server.api.LatestBlocksAggregator;
import sh.blockscope.server.api.TransactionResolver;

/**
 * Maps request method and URI onto the explorer operations.
 *
 * <pre>
 * GET /block/{hash}   -> Block
 * GET /tx/{txid}      -> Transaction
 * GET /latest_blocks  -> [Block, ...]
 * </pre>
 *
 * Routing matches the raw path; only the id segment is percent-decoded. Error bodies
 * are the operation's fixed message; node details only reach the log.
 */
public final class ExplorerRouter {

    private static final Logger log = LoggerFactory.getLogger(ExplorerRouter.class);

    static final String BLOCK_PREFIX = "/block/";
    static final String TX_PREFIX = "/tx/";
    static final String LATEST_BLOCKS = "/latest_blocks";

    static final String NOT_FOUND = "Not Found";
    static final String METHOD_NOT_ALLOWED = "Method Not Allowed";

    /** Writes BTC amounts and difficulty exactly as the node sent them. */
    static final ObjectMapper OUTPUT = JsonMapper.builder()
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private final BlockResolver blocks;
    private final TransactionResolver transactions;
    private final LatestBlocksAggregator latest;

    public ExplorerRouter(
            final BlockResolver blocks,
            final TransactionResolver transactions,
            final LatestBlocksAggregator latest) {
        this.blocks = Objects.requireNonNull(blocks, "blocks");
        this.transactions = Objects.requireNonNull(transactions, "transactions");
        this.latest = Objects.requireNonNull(latest, "latest");
    }

    HttpReply route(final String method, final String uri) {
        final String path = new QueryStringDecoder(uri).rawPath();

        final String blockHash = segmentAfter(path, BLOCK_PREFIX);
        if (blockHash != null) {
            return get(method, path, () -> blocks.resolve(blockHash), BlockResolver.FETCH_FAILED);
        }
        final String txid = segmentAfter(path, TX_PREFIX);
        if (txid != null) {
            return get(method, path, () -> transactions.resolve(txid), TransactionResolver.FETCH_FAILED);
        }
        if (LATEST_BLOCKS.equals(path)) {
            return get(method, path, latest::list, LatestBlocksAggregator.FETCH_FAILED);
        }
        return HttpReply.text(404, NOT_FOUND);
    }

    /** Returns the decoded single non-empty path segment after {@code prefix}, or null. */
    static String segmentAfter(final String path, final String prefix) {
        if (!path.startsWith(prefix)) {
            return null;
        }
        final String segment = path.substring(prefix.length());
        if (segment.isEmpty() || segment.indexOf('/') >= 0) {
            return null;
        }
        return decodeSegment(segment);
    }

    /**
     * Percent-decodes a path segment. A segment with a broken escape is returned raw;
     * the {@code %} it still contains fails id validation, so the client gets a 400.
     */
    private static String decodeSegment(final String segment) {
        try {
            return QueryStringDecoder.decodeComponent(segment);
        } catch (IllegalArgumentException e) {
            log.debug("Undecodable path segment {}: {}", segment, e.getMessage());
            return segment;
        }
    }

    private HttpReply get(
            final String method, final String path, final Supplier<?> operation, final String failureMessage) {
        if (!"GET".equals(method)) {
            return HttpReply.text(405, METHOD_NOT_ALLOWED);
        }
        try {
            return HttpReply.json(OUTPUT.writeValueAsBytes(operation.get()));
        } catch (ApiException e) {
            if (e.getCause() != null) {
                log.warn("{}: {}", e.getMessage(), e.getCause().toString());
            } else {
                log.debug("Rejected request: {}", e.getMessage());
            }
            return HttpReply.text(e.httpStatus(), e.getMessage());
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Unexpected failure serving {} {}", method, path, e);
            return HttpReply.text(500, failureMessage);
        }
    }
}
