package com.solstream.producer.metrics;

public interface MetricsSink {

    void send(String name, long value, String timestamp) throws MetricsSinkException, InterruptedException;
}
