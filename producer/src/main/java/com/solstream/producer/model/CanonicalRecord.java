package com.solstream.producer.model;

import com.fasterxml.jackson.databind.JsonNode;

public final class CanonicalRecord {

    public final String   key;
    public final JsonNode payload;

    public CanonicalRecord(String key, JsonNode payload) {
        this.key     = key;
        this.payload = payload.deepCopy();
    }
}
