// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.server.http;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import sh.blockscope.core.error.RpcException;
import sh.blockscope.core.model.Transaction;
import sh.blockscope.core.types.BlockHash;
import sh.blockscope.core.types.BlockHeight;
import sh.blockscope.rpc.NodeReader;
import sh.blockscope.rpc.internal.RpcUtils;
import sh.blockscope.server.TestChain;
import sh.blockscope.server.api.BlockResolver;
import sh.blockscope.server.api.LatestBlocksAggregator;
import sh.blockscope.server.api.TransactionResolver;

@ExtendWith(MockitoExtension.class)
class ExplorerRouterTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Mock
    private NodeReader reader;

    private ExplorerRouter router;

    private final Logger routerLog = (Logger) LoggerFactory.getLogger(ExplorerRouter.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void setUp() {
        BlockResolver blocks = new BlockResolver(reader);
        router = new ExplorerRouter(blocks, new TransactionResolver(reader),
                new LatestBlocksAggregator(reader, blocks));
        appender.start();
        routerLog.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        routerLog.detachAppender(appender);
    }

    @Test
    void malformedBlockHashIs400() {
        HttpReply reply = router.route("GET", "/block/not-a-hash");

        assertEquals(400, reply.status());
        assertEquals("Invalid block hash", reply.bodyAsString());
        assertTrue(reply.contentType().startsWith("text/plain"));
        verifyNoInteractions(reader);
    }

    @Test
    void brokenPercentEscapesAre400() {
        for (String segment : new String[] {"%zz", "abc%", "%4", TestChain.GENESIS_HASH.substring(2) + "%g0"}) {
            HttpReply reply = router.route("GET", "/block/" + segment);

            assertEquals(400, reply.status(), segment);
            assertEquals("Invalid block hash", reply.bodyAsString());
        }
        HttpReply tx = router.route("GET", "/tx/%zz");
        assertEquals(400, tx.status());
        assertEquals("Invalid transaction id", tx.bodyAsString());
        assertEquals(404, router.route("GET", "/nope/%zz").status());
        verifyNoInteractions(reader);
    }

    @Test
    void percentEncodedHashIsDecoded() {
        when(reader.getBlock(new BlockHash(TestChain.GENESIS_HASH))).thenReturn(TestChain.blockAt(0, 5));
        String encoded = "%30%30" + TestChain.GENESIS_HASH.substring(2);

        HttpReply reply = router.route("GET", "/block/" + encoded);

        assertEquals(200, reply.status());
    }

    @Test
    void blockIsServedAsJson() throws Exception {
        when(reader.getBlock(new BlockHash(TestChain.GENESIS_HASH)))
                .thenReturn(RpcUtils.MAPPER.convertValue(TestChain.blockJson(0, 5),
                        sh.blockscope.core.model.Block.class));

        HttpReply reply = router.route("GET", "/block/" + TestChain.GENESIS_HASH + "?verbose=1");

        assertEquals(200, reply.status());
        assertEquals("application/json", reply.contentType());
        JsonNode body = JSON.readTree(reply.body());
        assertEquals(TestChain.GENESIS_HASH, body.get("hash").asText());
        assertEquals(0, body.get("height").asInt());
        assertFalse(body.has("previousblockhash"));
        assertEquals(TestChain.hashAt(1), body.get("nextblockhash").asText());
        assertTrue(reply.bodyAsString().contains("\"difficulty\":95672703408223.94"));
    }

    @Test
    void unknownBlockIs500WithoutNodeDetails() {
        when(reader.getBlock(any())).thenThrow(RpcException.nodeRejected(-5, "Block not found", null, 9L));

        HttpReply reply = router.route("GET", "/block/" + TestChain.hashAt(42));

        assertEquals(500, reply.status());
        assertEquals("Failed to retrieve block information", reply.bodyAsString());
        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("Block not found"));
    }

    @Test
    void malformedTxidIs400() {
        HttpReply reply = router.route("GET", "/tx/1234");

        assertEquals(400, reply.status());
        assertEquals("Invalid transaction id", reply.bodyAsString());
    }

    @Test
    void transactionIsServedAsJson() throws Exception {
        when(reader.getRawTransaction(any()))
                .thenReturn(RpcUtils.MAPPER.convertValue(TestChain.coinbaseJson(), Transaction.class));

        HttpReply reply = router.route("GET", "/tx/" + TestChain.GENESIS_COINBASE_TXID);

        assertEquals(200, reply.status());
        JsonNode body = JSON.readTree(reply.body());
        assertEquals(TestChain.GENESIS_COINBASE_TXID, body.get("txid").asText());
        assertEquals("04ffff001d0104", body.get("vin").get(0).get("coinbase").asText());
        assertTrue(reply.bodyAsString().contains("\"value\":50.00000000"));
    }

    @Test
    void latestBlocksIsBareArray() throws Exception {
        when(reader.getBlockCount()).thenReturn(new BlockHeight(2));
        for (long h = 0; h <= 2; h++) {
            when(reader.getBlockHash(new BlockHeight(h))).thenReturn(new BlockHash(TestChain.hashAt(h)));
            when(reader.getBlock(new BlockHash(TestChain.hashAt(h)))).thenReturn(TestChain.blockAt(h, 2));
        }

        HttpReply reply = router.route("GET", "/latest_blocks");

        assertEquals(200, reply.status());
        JsonNode body = JSON.readTree(reply.body());
        assertTrue(body.isArray());
        assertEquals(3, body.size());
        assertEquals(2, body.get(0).get("height").asInt());
        assertEquals(0, body.get(2).get("height").asInt());
    }

    @Test
    void latestBlocksFailureIs500() {
        when(reader.getBlockCount()).thenThrow(
                RpcException.transport("Network error", 1L, new java.net.ConnectException("refused")));

        HttpReply reply = router.route("GET", "/latest_blocks");

        assertEquals(500, reply.status());
        assertEquals("Failed to retrieve latest blocks", reply.bodyAsString());
    }

    @Test
    void unknownPathsAre404() {
        assertEquals(404, router.route("GET", "/").status());
        assertEquals(404, router.route("GET", "/block/").status());
        assertEquals(404, router.route("GET", "/latest_blocks/").status());
        assertEquals(404, router.route("GET", "/block/" + TestChain.GENESIS_HASH + "/").status());
        assertEquals(404, router.route("GET", "/blocks/" + TestChain.GENESIS_HASH).status());
        assertEquals("Not Found", router.route("GET", "/nope").bodyAsString());
        verifyNoInteractions(reader);
    }

    @Test
    void nonGetIs405() {
        assertEquals(405, router.route("POST", "/latest_blocks").status());
        assertEquals(405, router.route("DELETE", "/block/" + TestChain.GENESIS_HASH).status());
        assertEquals("Method Not Allowed", router.route("PUT", "/tx/abc").bodyAsString());
        verifyNoInteractions(reader);
    }

    @Test
    void unexpectedFailureIs500WithRouteMessage() {
        when(reader.getBlock(any())).thenThrow(new IllegalStateException("boom"));

        HttpReply reply = router.route("GET", "/block/" + TestChain.GENESIS_HASH);

        assertEquals(500, reply.status());
        assertEquals("Failed to retrieve block information", reply.bodyAsString());
        assertEquals(Level.ERROR, appender.list.get(0).getLevel());
    }

    @Test
    void segmentAfterPrefix() {
        assertEquals("abc", ExplorerRouter.segmentAfter("/block/abc", "/block/"));
        assertNull(ExplorerRouter.segmentAfter("/block/", "/block/"));
        assertNull(ExplorerRouter.segmentAfter("/block/a/b", "/block/"));
        assertNull(ExplorerRouter.segmentAfter("/tx/abc", "/block/"));
        assertEquals("ab", ExplorerRouter.segmentAfter("/block/%61b", "/block/"));
        assertEquals("%zz", ExplorerRouter.segmentAfter("/block/%zz", "/block/"));
    }
}
