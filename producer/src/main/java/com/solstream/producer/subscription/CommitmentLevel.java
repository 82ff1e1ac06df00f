package com.solstream.producer.subscription;

import com.fasterxml.jackson.annotation.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

public enum CommitmentLevel {
    PROCESSED,
    CONFIRMED,
    FINALIZED;

    private static final Logger log = LoggerFactory.getLogger(CommitmentLevel.class);

    public static CommitmentLevel parse(String name) {
        if (name == null) return null;
        CommitmentLevel level = lookup(name);
        if (level == null) {
            log.warn("config.unknown_commitment value={} fallback={}", name, PROCESSED);
            return PROCESSED;
        }
        return level;
    }

    public static CommitmentLevel lookup(String name) {
        if (name == null) return null;
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("SLOT_")) normalized = normalized.substring(5);
        for (CommitmentLevel level : values()) {
            if (level.name().equals(normalized)) return level;
        }
        return null;
    }

    public String rpcName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonValue
    public String wireName() {
        return name();
    }
}
