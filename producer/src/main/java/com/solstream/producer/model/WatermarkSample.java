package com.solstream.producer.model;

public final class WatermarkSample {

    public final long observedSlot;
    public final long processedSlot;
    public final long confirmedSlot;
    public final long finalizedSlot;

    public WatermarkSample(long observedSlot, long processedSlot, long confirmedSlot, long finalizedSlot) {
        this.observedSlot  = observedSlot;
        this.processedSlot = processedSlot;
        this.confirmedSlot = confirmedSlot;
        this.finalizedSlot = finalizedSlot;
    }

    public long processedDelta() { return processedSlot - observedSlot; }
    public long confirmedDelta() { return confirmedSlot - observedSlot; }
    public long finalizedDelta() { return finalizedSlot - observedSlot; }
}
