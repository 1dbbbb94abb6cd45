// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.rpc;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import sh.blockscope.core.BlockscopeDebug;
import sh.blockscope.core.error.RpcException;

class HttpBitcoinProviderTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private HttpServer server;
    private String url;
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();
    private final List<JsonNode> requests = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        url = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
    }

    @AfterEach
    void tearDown() {
        BlockscopeDebug.setRpcLogging(false);
        BlockscopeDebug.setHttpLogging(false);
        server.stop(0);
    }

    private HttpBitcoinProvider provider() {
        return HttpBitcoinProvider.builder(url).credentials("alice", "s3cret").build();
    }

    private void answer(int status, String body) {
        server.createContext("/", exchange -> {
            record(exchange);
            respond(exchange, status, body);
        });
    }

    private void record(HttpExchange exchange) throws IOException {
        authHeaders.add(exchange.getRequestHeaders().getFirst("Authorization"));
        try (InputStream in = exchange.getRequestBody()) {
            requests.add(JSON.readTree(in.readAllBytes()));
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void sendSuccessResponse() {
        answer(200, """
                {"result":850123,"error":null,"id":"1"}
                """);

        JsonRpcResponse response = provider().send("getblockcount", List.of());

        assertEquals(850123, ((Number) response.result()).intValue());
        assertFalse(response.hasError());
    }

    @Test
    void sendsBasicAuthAndJsonRpcEnvelope() {
        answer(200, """
                {"result":"ok","error":null,"id":"1"}
                """);

        HttpBitcoinProvider provider = provider();
        provider.send("getblockhash", List.of(5));
        provider.send("getblockcount", null);

        // base64("alice:s3cret")
        assertEquals(List.of("Basic YWxpY2U6czNjcmV0", "Basic YWxpY2U6czNjcmV0"), authHeaders);

        JsonNode first = requests.get(0);
        assertEquals("2.0", first.get("jsonrpc").asText());
        assertEquals("getblockhash", first.get("method").asText());
        assertEquals(5, first.get("params").get(0).asInt());
        assertEquals("1", first.get("id").asText());

        JsonNode second = requests.get(1);
        assertEquals("2", second.get("id").asText());
        assertTrue(second.get("params").isArray());
        assertEquals(0, second.get("params").size());
    }

    @Test
    void jsonRpcErrorIsNodeRejected() {
        answer(200, """
                {"result":null,"error":{"code":-8,"message":"Block height out of range"},"id":"1"}
                """);

        RpcException ex = assertThrows(RpcException.class, () -> provider().send("getblockhash", List.of(999999)));

        assertEquals(RpcException.Kind.NODE_REJECTED, ex.kind());
        assertEquals(-8, ex.code());
        assertTrue(ex.getMessage().contains("Block height out of range"));
        assertEquals(Long.valueOf(1L), ex.requestId());
    }

    @Test
    void jsonRpcErrorInNon2xxBodyIsNodeRejected() {
        answer(404, """
                {"result":null,"error":{"code":-5,"message":"Block not found"},"id":"1"}
                """);

        RpcException ex = assertThrows(RpcException.class, () -> provider().send("getblock", List.of("00", 1)));

        assertEquals(RpcException.Kind.NODE_REJECTED, ex.kind());
        assertEquals(-5, ex.code());
        assertNull(ex.httpStatus());
    }

    @Test
    void plainNon2xxIsTransportWithStatus() {
        answer(401, "");

        RpcException ex = assertThrows(RpcException.class, () -> provider().send("getblockcount", List.of()));

        assertEquals(RpcException.Kind.TRANSPORT, ex.kind());
        assertEquals(RpcException.HTTP_ERROR, ex.code());
        assertEquals(Integer.valueOf(401), ex.httpStatus());
    }

    @Test
    void malformedBodyIsDecode() {
        answer(200, "<html>not json</html>");

        RpcException ex = assertThrows(RpcException.class, () -> provider().send("getblockcount", List.of()));

        assertEquals(RpcException.Kind.DECODE, ex.kind());
        assertEquals(RpcException.PARSE_ERROR, ex.code());
        assertEquals("<html>not json</html>", ex.data());
    }

    @Test
    void connectionRefusedIsTransport() throws IOException {
        HttpServer closed = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        int port = closed.getAddress().getPort();
        closed.stop(0);

        HttpBitcoinProvider provider = HttpBitcoinProvider.builder("http://127.0.0.1:" + port)
                .credentials("alice", "s3cret")
                .connectTimeout(Duration.ofSeconds(2))
                .build();

        RpcException ex = assertThrows(RpcException.class, () -> provider.send("getblockcount", List.of()));

        assertEquals(RpcException.Kind.TRANSPORT, ex.kind());
        assertEquals(RpcException.TRANSPORT_ERROR, ex.code());
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    void readTimeoutIsTransport() {
        server.createContext("/", exchange -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "{\"result\":1,\"error\":null,\"id\":\"1\"}");
        });

        HttpBitcoinProvider provider = HttpBitcoinProvider.builder(url)
                .credentials("alice", "s3cret")
                .readTimeout(Duration.ofMillis(200))
                .build();

        RpcException ex = assertThrows(RpcException.class, () -> provider.send("getblockcount", List.of()));

        assertEquals(RpcException.Kind.TRANSPORT, ex.kind());
        assertInstanceOf(HttpTimeoutException.class, ex.getCause());
    }

    @Test
    void debugLogsNeverContainCredentials() {
        answer(200, """
                {"result":1,"error":null,"id":"1"}
                """);
        Logger debug = (Logger) LoggerFactory.getLogger("sh.blockscope.debug");
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        debug.addAppender(appender);
        try {
            BlockscopeDebug.setRpcLogging(true);
            HttpBitcoinProvider provider = provider();
            provider.send("getblockcount", List.of());

            assertEquals(1, appender.list.size());
            String line = appender.list.get(0).getFormattedMessage();
            assertTrue(line.contains("getblockcount"));
            assertFalse(line.contains("s3cret"));
            assertFalse(line.contains("YWxpY2U6czNjcmV0"));
            assertFalse(provider.config().toString().contains("s3cret"));
        } finally {
            debug.detachAppender(appender);
        }
    }
}
