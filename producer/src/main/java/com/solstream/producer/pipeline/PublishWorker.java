package com.solstream.producer.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.solstream.producer.format.FormatException;
import com.solstream.producer.format.MessageFormatter;
import com.solstream.producer.kafka.PublishException;
import com.solstream.producer.kafka.RecordPublisher;
import com.solstream.producer.metrics.MetricsRegistry;
import com.solstream.producer.model.CanonicalRecord;
import com.solstream.producer.model.DeadLetter;
import com.solstream.producer.model.ProcessingMessage;
import com.solstream.producer.model.UpdateEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sole consumer of the processing queue. Messages are formatted and published one at a time in
 * queue order. A failed publish is fatal: the worker logs it, asks the terminator to end the
 * process and dequeues nothing further.
 */
public class PublishWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PublishWorker.class);

    private static final int EXIT_FAILURE = 1;

    private final ProcessingQueue     queue;
    private final MessageFormatter    formatter;
    private final RecordPublisher     publisher;
    private final MetricsRegistry     metrics;
    private final FormatFailurePolicy policy;
    private final ProcessTerminator   terminator;
    private final ObjectMapper        mapper = new ObjectMapper();

    private volatile long published;

    public PublishWorker(ProcessingQueue queue, MessageFormatter formatter, RecordPublisher publisher,
                         MetricsRegistry metrics, FormatFailurePolicy policy, ProcessTerminator terminator) {
        this.queue      = queue;
        this.formatter  = formatter;
        this.publisher  = publisher;
        this.metrics    = metrics;
        this.policy     = policy;
        this.terminator = terminator;
    }

    @Override
    public void run() {
        log.info("worker.started format_failure_policy={}", policy);
        try {
            boolean running = true;
            while (running) {
                ProcessingMessage message = queue.take();
                running = switch (message.kind()) {
                    case TRANSACTION    -> handleTransaction(message.transaction());
                    case BLOCK_METADATA -> handleBlockMeta(message.blockMeta());
                    case SHUTDOWN       -> false;
                };
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("worker.interrupted");
        } finally {
            queue.closeReceiver();
            log.info("worker.stopped published={}", published);
        }
    }

    private boolean handleTransaction(UpdateEnvelope.Transaction update) {
        String key;
        try {
            key = MessageFormatter.transactionKey(update);
        } catch (FormatException e) {
            return unkeyed("transaction", update.slot, e);
        }

        ObjectNode payload;
        try {
            payload = formatter.formatTransaction(update);
        } catch (FormatException e) {
            metrics.incrementErrors();
            log.warn("worker.format_failed kind=transaction key={} slot={} reason={} error={} policy={}",
                    key, update.slot, e.kind(), e.getMessage(), policy);
            switch (policy) {
                case PUBLISH_EMPTY:
                    payload = mapper.createObjectNode();
                    break;
                case DEAD_LETTER:
                    return deadLetter(new DeadLetter(key, "transaction", update.slot, e.getMessage()));
                default:
                    return true;
            }
        }

        if (!publish(new CanonicalRecord(key, payload))) return false;
        metrics.incrementTransactions();
        return true;
    }

    private boolean handleBlockMeta(UpdateEnvelope.BlockMeta update) {
        String key;
        try {
            key = MessageFormatter.blockMetaKey(update);
        } catch (FormatException e) {
            return unkeyed("block_meta", update.slot, e);
        }
        return publish(new CanonicalRecord(key, formatter.formatBlockMeta(update)));
    }

    private boolean unkeyed(String kind, long slot, FormatException e) {
        metrics.incrementErrors();
        log.warn("worker.unkeyed_update kind={} slot={} error={}", kind, slot, e.getMessage());
        if (policy == FormatFailurePolicy.DEAD_LETTER) {
            return deadLetter(new DeadLetter(null, kind, slot, e.getMessage()));
        }
        return true;
    }

    private boolean publish(CanonicalRecord record) {
        try {
            publisher.publish(record);
            published++;
            return true;
        } catch (PublishException e) {
            return terminate("kafka.publish_failed key=" + record.key, e);
        }
    }

    private boolean deadLetter(DeadLetter letter) {
        try {
            publisher.publishDeadLetter(letter);
            return true;
        } catch (PublishException e) {
            return terminate("kafka.dead_letter_failed kind=" + letter.kind, e);
        }
    }

    private boolean terminate(String event, PublishException e) {
        log.error("{} error={}", event, e.getMessage(), e);
        log.error("worker.fatal exiting status={}", EXIT_FAILURE);
        terminator.terminate(EXIT_FAILURE);
        return false;
    }

    public long published() {
        return published;
    }
}
