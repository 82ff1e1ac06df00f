package com.solstream.producer.pipeline;

import com.solstream.producer.metrics.MetricsRegistry;
import com.solstream.producer.model.ProcessingMessage;
import com.solstream.producer.model.UpdateEnvelope;
import com.solstream.producer.ws.TransportException;
import com.solstream.producer.ws.UpdateSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the upstream feed, forwards transactions and block metadata onto the processing queue
 * and finally enqueues the shutdown sentinel. Runs on one thread; a full queue blocks it,
 * which in turn stops reads from the feed.
 */
public class StreamDispatcher implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StreamDispatcher.class);

    private static final UpdateEnvelope.Visitor<ProcessingMessage> CLASSIFIER = new Classifier();

    private final UpdateSource     source;
    private final ProcessingQueue  queue;
    private final LagSampler       lagSampler;
    private final MetricsRegistry  metrics;

    private volatile DispatcherState state = DispatcherState.RUNNING;
    private volatile long forwarded;

    public StreamDispatcher(UpdateSource source, ProcessingQueue queue,
                            LagSampler lagSampler, MetricsRegistry metrics) {
        this.source     = source;
        this.queue      = queue;
        this.lagSampler = lagSampler;
        this.metrics    = metrics;
    }

    @Override
    public void run() {
        log.info("dispatcher.started queue_capacity={}", queue.capacity());
        boolean consumerGone = false;
        try {
            while (true) {
                UpdateEnvelope update;
                try {
                    update = source.next();
                } catch (TransportException e) {
                    log.warn("stream.item_error error={}", e.getMessage());
                    metrics.incrementErrors();
                    continue;
                }
                if (update == null) {
                    log.info("stream.ended forwarded={}", forwarded);
                    break;
                }

                ProcessingMessage message = update.accept(CLASSIFIER);
                if (message == null) continue;

                lagSampler.maybeSample(message.slot());
                try {
                    queue.put(message);
                    forwarded++;
                } catch (ChannelClosedException e) {
                    log.error("dispatcher.queue_closed forwarded={}", forwarded);
                    consumerGone = true;
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("dispatcher.interrupted forwarded={}", forwarded);
            consumerGone = true;
        } catch (RuntimeException e) {
            log.error("dispatcher.failed forwarded={} error={}", forwarded, e.getMessage(), e);
            throw e;
        } finally {
            drain(consumerGone);
        }
    }

    private void drain(boolean bestEffort) {
        state = DispatcherState.DRAINING;
        if (bestEffort) {
            if (!queue.tryPut(ProcessingMessage.shutdown())) {
                log.debug("dispatcher.shutdown_not_enqueued");
            }
        } else {
            try {
                queue.put(ProcessingMessage.shutdown());
            } catch (ChannelClosedException e) {
                log.debug("dispatcher.shutdown_not_enqueued reason=receiver_closed");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("dispatcher.shutdown_interrupted");
            }
        }
        state = DispatcherState.STOPPED;
        log.info("dispatcher.stopped forwarded={}", forwarded);
    }

    public DispatcherState state() {
        return state;
    }

    public long forwarded() {
        return forwarded;
    }

    private static final class Classifier implements UpdateEnvelope.Visitor<ProcessingMessage> {

        @Override
        public ProcessingMessage visitTransaction(UpdateEnvelope.Transaction update) {
            return ProcessingMessage.transaction(update);
        }

        @Override
        public ProcessingMessage visitBlockMeta(UpdateEnvelope.BlockMeta update) {
            return ProcessingMessage.blockMetadata(update);
        }

        @Override public ProcessingMessage visitAccount(UpdateEnvelope.Account update)                     { return null; }
        @Override public ProcessingMessage visitSlot(UpdateEnvelope.Slot update)                           { return null; }
        @Override public ProcessingMessage visitTransactionStatus(UpdateEnvelope.TransactionStatus update) { return null; }
        @Override public ProcessingMessage visitEntry(UpdateEnvelope.Entry update)                         { return null; }
        @Override public ProcessingMessage visitBlock(UpdateEnvelope.Block update)                         { return null; }
        @Override public ProcessingMessage visitPing(UpdateEnvelope.Ping update)                           { return null; }
        @Override public ProcessingMessage visitPong(UpdateEnvelope.Pong update)                           { return null; }
    }
}
