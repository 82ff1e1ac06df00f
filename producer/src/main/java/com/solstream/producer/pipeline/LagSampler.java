package com.solstream.producer.pipeline;

import com.solstream.producer.model.WatermarkSample;
import com.solstream.producer.rpc.WatermarkClient;
import com.solstream.producer.subscription.CommitmentLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/** Logs upstream watermark lag at most once per window. */
public class LagSampler {

    private static final Logger log = LoggerFactory.getLogger(LagSampler.class);

    static final long WINDOW_NANOS = TimeUnit.SECONDS.toNanos(5);

    private final WatermarkClient client;
    private final LongSupplier    nanoClock;
    private long                  lastSampleNanos;

    public LagSampler(WatermarkClient client) {
        this(client, System::nanoTime);
    }

    LagSampler(WatermarkClient client, LongSupplier nanoClock) {
        this.client          = client;
        this.nanoClock       = nanoClock;
        this.lastSampleNanos = nanoClock.getAsLong();
    }

    public static LagSampler disabled() {
        return new LagSampler(null, System::nanoTime);
    }

    public WatermarkSample maybeSample(long observedSlot) throws InterruptedException {
        if (client == null) return null;
        if (nanoClock.getAsLong() - lastSampleNanos < WINDOW_NANOS) return null;

        try {
            Long processed = query(CommitmentLevel.PROCESSED);
            Long confirmed = query(CommitmentLevel.CONFIRMED);
            Long finalized = query(CommitmentLevel.FINALIZED);
            if (processed == null || confirmed == null || finalized == null) return null;

            WatermarkSample sample = new WatermarkSample(observedSlot, processed, confirmed, finalized);
            log.info("stream.lag slot={} watermarks=[P: {}, C: {}, F: {}] deltas=[P: {}, C: {}, F: {}]",
                    sample.observedSlot, sample.processedSlot, sample.confirmedSlot, sample.finalizedSlot,
                    sample.processedDelta(), sample.confirmedDelta(), sample.finalizedDelta());
            return sample;
        } finally {
            lastSampleNanos = nanoClock.getAsLong();
        }
    }

    private Long query(CommitmentLevel level) throws InterruptedException {
        try {
            return client.getSlot(level);
        } catch (IOException | RuntimeException e) {
            log.debug("stream.watermark_failed commitment={} error={}", level, e.getMessage());
            return null;
        }
    }
}
