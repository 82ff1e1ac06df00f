package com.solstream.producer.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solstream.producer.subscription.CommitmentLevel;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RpcWatermarkClient")
class RpcWatermarkClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<String> request = new AtomicReference<>();
    private final AtomicReference<String> response = new AtomicReference<>("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":250000000}");
    private HttpServer server;
    private RpcWatermarkClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            request.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] out = response.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, out.length);
            exchange.getResponseBody().write(out);
            exchange.close();
        });
        server.start();
        client = new RpcWatermarkClient("http://127.0.0.1:" + server.getAddress().getPort(), mapper);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("sends getSlot with the commitment and returns the result")
    void getSlot() throws Exception {
        assertThat(client.getSlot(CommitmentLevel.FINALIZED)).isEqualTo(250_000_000L);

        JsonNode sent = mapper.readTree(request.get());
        assertThat(sent.get("method").asText()).isEqualTo("getSlot");
        assertThat(sent.get("params").get(0).get("commitment").asText()).isEqualTo("finalized");
    }

    @Test
    @DisplayName("an RPC error object is an IOException")
    void rpcError() {
        response.set("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000,\"message\":\"busy\"}}");

        assertThatThrownBy(() -> client.getSlot(CommitmentLevel.PROCESSED))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("busy");
    }

    @Test
    @DisplayName("a non-numeric result is an IOException")
    void badResult() {
        response.set("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"soon\"}");

        assertThatThrownBy(() -> client.getSlot(CommitmentLevel.CONFIRMED)).isInstanceOf(IOException.class);
    }
}
