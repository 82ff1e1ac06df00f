package com.solstream.producer.health;

import com.solstream.producer.metrics.MetricsRegistry;
import com.solstream.producer.pipeline.DispatcherState;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

public class HealthServer {

    private static final Logger log = LoggerFactory.getLogger(HealthServer.class);

    private final HttpServer                server;
    private final MetricsRegistry           metrics;
    private final Supplier<DispatcherState> dispatcherState;

    public HealthServer(int port, MetricsRegistry metrics, Supplier<DispatcherState> dispatcherState) throws IOException {
        this.metrics         = metrics;
        this.dispatcherState = dispatcherState;
        this.server          = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", exchange -> {
            DispatcherState state = dispatcherState.get();
            byte[] body = snapshot(state).getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(state == DispatcherState.STOPPED ? 503 : 200, body.length);
            exchange.getResponseBody().write(body);
            exchange.getResponseBody().close();
        });
        server.setExecutor(null);
        Thread thread = new Thread(server::start, "health-server");
        thread.setDaemon(true);
        thread.start();
        log.info("health.started port={}", port());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public void stop() {
        server.stop(0);
    }

    private String snapshot(DispatcherState state) {
        return String.format(
            "{\"status\":\"%s\",\"transactions\":%d,\"accounts\":%d,\"errors\":%d,\"dispatcher\":\"%s\"}",
            state == DispatcherState.STOPPED ? "stopped" : "ok",
            metrics.transactions(), metrics.accounts(), metrics.errors(), state
        );
    }
}
