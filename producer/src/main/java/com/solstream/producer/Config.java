package com.solstream.producer;

public class Config {
    // ── Kafka ─────────────────────────────────────────────────────────────────
    public final String bootstrapServers = env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092");
    public final int    kafkaLingerMs    = Integer.parseInt(env("KAFKA_LINGER_MS", "5"));

    // ── Process ───────────────────────────────────────────────────────────────
    public final String configPath       = env("CONFIG_PATH", "config.yaml");
    public final int    healthPort       = Integer.parseInt(env("HEALTH_PORT", "8080"));

    private static String env(String key, String defaultValue) {
        return System.getenv().getOrDefault(key, defaultValue);
    }
}
