package com.solstream.producer.model;

public class DeadLetter {
    public String key;
    public String kind;
    public String error;
    public long   slot;
    public long   ingestionTimeMs;

    public DeadLetter(String key, String kind, long slot, String error) {
        this.key             = key;
        this.kind            = kind;
        this.slot            = slot;
        this.error           = error;
        this.ingestionTimeMs = System.currentTimeMillis();
    }
}
