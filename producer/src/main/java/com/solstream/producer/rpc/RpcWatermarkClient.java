package com.solstream.producer.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.solstream.producer.subscription.CommitmentLevel;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

public class RpcWatermarkClient implements WatermarkClient {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final URI          endpoint;
    private final ObjectMapper mapper;
    private final HttpClient   http;
    private final AtomicLong   requestIds = new AtomicLong();

    public RpcWatermarkClient(String endpoint, ObjectMapper mapper) {
        this(URI.create(endpoint), mapper, HttpClient.newBuilder().connectTimeout(TIMEOUT).build());
    }

    RpcWatermarkClient(URI endpoint, ObjectMapper mapper, HttpClient http) {
        this.endpoint = endpoint;
        this.mapper   = mapper;
        this.http     = http;
    }

    @Override
    public long getSlot(CommitmentLevel level) throws IOException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        body.put("jsonrpc", "2.0");
        body.put("id", requestIds.incrementAndGet());
        body.put("method", "getSlot");
        body.putArray("params").addObject().put("commitment", level.rpcName());

        HttpRequest req = HttpRequest.newBuilder(endpoint)
                .timeout(TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() / 100 != 2) {
            throw new IOException("getSlot " + level.rpcName() + " returned HTTP " + resp.statusCode());
        }

        JsonNode root = mapper.readTree(resp.body());
        if (root.hasNonNull("error")) {
            throw new IOException("getSlot " + level.rpcName() + " failed: " + root.get("error"));
        }
        JsonNode result = root.get("result");
        if (result == null || !result.isIntegralNumber()) {
            throw new IOException("getSlot " + level.rpcName() + " returned no slot");
        }
        return result.asLong();
    }
}
