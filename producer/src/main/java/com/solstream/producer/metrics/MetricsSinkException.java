package com.solstream.producer.metrics;

public class MetricsSinkException extends Exception {

    public MetricsSinkException(String message) {
        super(message);
    }

    public MetricsSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
