package com.solstream.producer.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

public class BetterStackMetricsSink implements MetricsSink {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final URI          endpoint;
    private final String       apiToken;
    private final ObjectMapper mapper;
    private final HttpClient   http;

    public BetterStackMetricsSink(String endpoint, String apiToken, ObjectMapper mapper) {
        this.endpoint = URI.create(endpoint);
        this.apiToken = apiToken;
        this.mapper   = mapper;
        this.http     = HttpClient.newBuilder().connectTimeout(TIMEOUT).build();
    }

    @Override
    public void send(String name, long value, String timestamp) throws MetricsSinkException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        body.put("dt", timestamp);
        body.put("name", name);
        body.putObject("gauge").put("value", value);

        try {
            HttpRequest req = HttpRequest.newBuilder(endpoint)
                    .timeout(TIMEOUT)
                    .header("Authorization", "Bearer " + apiToken)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) {
                throw new MetricsSinkException("metric " + name + " rejected with HTTP " + resp.statusCode());
            }
        } catch (IOException e) {
            throw new MetricsSinkException("metric " + name + " not delivered: " + e.getMessage(), e);
        }
    }
}
