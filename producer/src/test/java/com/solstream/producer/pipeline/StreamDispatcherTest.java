package com.solstream.producer.pipeline;

import com.solstream.producer.metrics.MetricsRegistry;
import com.solstream.producer.model.ProcessingMessage;
import com.solstream.producer.model.UpdateEnvelope;
import com.solstream.producer.rpc.WatermarkClient;
import com.solstream.producer.ws.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static com.solstream.producer.pipeline.PipelineFixtures.ScriptedSource;
import static com.solstream.producer.pipeline.PipelineFixtures.blockMeta;
import static com.solstream.producer.pipeline.PipelineFixtures.transaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StreamDispatcher")
class StreamDispatcherTest {

    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry();
    }

    private static List<ProcessingMessage> drain(ProcessingQueue queue) throws InterruptedException {
        List<ProcessingMessage> out = new ArrayList<>();
        while (queue.size() > 0) out.add(queue.take());
        return out;
    }

    @Test
    @DisplayName("forwards transactions and block metadata in order and drops every other kind")
    void classification() throws Exception {
        ScriptedSource source = new ScriptedSource()
                .add(new UpdateEnvelope.Slot(9, 8L, "SLOT_PROCESSED"))
                .add(transaction(10, 1))
                .add(new UpdateEnvelope.Ping())
                .add(new UpdateEnvelope.Entry(10, 0, 1, new byte[]{1}, 0))
                .add(blockMeta(10, "HASH"))
                .add(new UpdateEnvelope.Pong(3))
                .add(new UpdateEnvelope.Account(10, false, null))
                .add(transaction(11, 2));
        ProcessingQueue queue = new ProcessingQueue(16);
        StreamDispatcher dispatcher = new StreamDispatcher(source, queue, LagSampler.disabled(), metrics);

        dispatcher.run();

        List<ProcessingMessage> messages = drain(queue);
        assertThat(messages).extracting(ProcessingMessage::kind).containsExactly(
                ProcessingMessage.Kind.TRANSACTION,
                ProcessingMessage.Kind.BLOCK_METADATA,
                ProcessingMessage.Kind.TRANSACTION,
                ProcessingMessage.Kind.SHUTDOWN);
        assertThat(messages.get(0).slot()).isEqualTo(10);
        assertThat(messages.get(2).slot()).isEqualTo(11);
        assertThat(dispatcher.forwarded()).isEqualTo(3);
        assertThat(metrics.accounts()).isZero();
        assertThat(metrics.errors()).isZero();
    }

    @Test
    @DisplayName("a transport error on one item is counted and the stream continues")
    void transportErrorContinues() throws Exception {
        ScriptedSource source = new ScriptedSource()
                .add(transaction(1, 1))
                .add(new TransportException("bad frame"))
                .add(transaction(2, 2));
        ProcessingQueue queue = new ProcessingQueue(8);
        StreamDispatcher dispatcher = new StreamDispatcher(source, queue, LagSampler.disabled(), metrics);

        dispatcher.run();

        assertThat(drain(queue)).extracting(ProcessingMessage::kind).containsExactly(
                ProcessingMessage.Kind.TRANSACTION,
                ProcessingMessage.Kind.TRANSACTION,
                ProcessingMessage.Kind.SHUTDOWN);
        assertThat(metrics.errors()).isEqualTo(1);
    }

    @Test
    @DisplayName("end of stream enqueues exactly one shutdown and stops")
    void endOfStream() throws Exception {
        ProcessingQueue queue = new ProcessingQueue(4);
        StreamDispatcher dispatcher = new StreamDispatcher(new ScriptedSource(), queue, LagSampler.disabled(), metrics);
        assertThat(dispatcher.state()).isEqualTo(DispatcherState.RUNNING);

        dispatcher.run();

        assertThat(drain(queue)).containsExactly(ProcessingMessage.shutdown());
        assertThat(dispatcher.state()).isEqualTo(DispatcherState.STOPPED);
    }

    @Test
    @Timeout(10)
    @DisplayName("stops reading once the consumer has gone")
    void consumerGone() {
        ScriptedSource source = new ScriptedSource()
                .add(transaction(1, 1))
                .add(transaction(2, 2));
        ProcessingQueue queue = new ProcessingQueue(4);
        queue.closeReceiver();
        StreamDispatcher dispatcher = new StreamDispatcher(source, queue, LagSampler.disabled(), metrics);

        dispatcher.run();

        assertThat(dispatcher.state()).isEqualTo(DispatcherState.STOPPED);
        assertThat(dispatcher.forwarded()).isZero();
        assertThat(queue.size()).isZero();
    }

    @Test
    @Timeout(10)
    @DisplayName("a full queue holds the dispatcher back until the worker drains it")
    void backpressureReachesSource() throws Exception {
        ScriptedSource source = new ScriptedSource();
        for (int i = 0; i < 20; i++) source.add(transaction(i, i));
        ProcessingQueue queue = new ProcessingQueue(2);
        StreamDispatcher dispatcher = new StreamDispatcher(source, queue, LagSampler.disabled(), metrics);

        Thread thread = new Thread(dispatcher);
        thread.start();
        Thread.sleep(200);

        assertThat(queue.size()).isEqualTo(2);
        assertThat(dispatcher.state()).isEqualTo(DispatcherState.RUNNING);

        List<ProcessingMessage> received = new ArrayList<>();
        ProcessingMessage message;
        do {
            message = queue.take();
            received.add(message);
        } while (message.kind() != ProcessingMessage.Kind.SHUTDOWN);
        thread.join();

        assertThat(received).hasSize(21);
        assertThat(dispatcher.state()).isEqualTo(DispatcherState.STOPPED);
    }

    @Test
    @DisplayName("a watermark client that throws unchecked does not disturb forwarding")
    void lagFailureIgnored() throws Exception {
        AtomicLong clock = new AtomicLong();
        WatermarkClient broken = level -> {
            throw new IllegalArgumentException("invalid URI scheme ws");
        };
        LagSampler sampler = new LagSampler(broken, () -> clock.addAndGet(LagSampler.WINDOW_NANOS));
        ScriptedSource source = new ScriptedSource()
                .add(transaction(1, 1))
                .add(transaction(2, 2));
        ProcessingQueue queue = new ProcessingQueue(4);
        StreamDispatcher dispatcher = new StreamDispatcher(source, queue, sampler, metrics);

        dispatcher.run();

        assertThat(drain(queue)).extracting(ProcessingMessage::kind).containsExactly(
                ProcessingMessage.Kind.TRANSACTION,
                ProcessingMessage.Kind.TRANSACTION,
                ProcessingMessage.Kind.SHUTDOWN);
        assertThat(dispatcher.state()).isEqualTo(DispatcherState.STOPPED);
    }

    @Test
    @DisplayName("an unexpected failure still enqueues shutdown so the worker can finish")
    void unexpectedFailureDrains() throws Exception {
        ScriptedSource source = new ScriptedSource() {
            @Override
            public UpdateEnvelope next() {
                throw new IllegalStateException("socket gone");
            }
        };
        ProcessingQueue queue = new ProcessingQueue(4);
        StreamDispatcher dispatcher = new StreamDispatcher(source, queue, LagSampler.disabled(), metrics);

        assertThatThrownBy(dispatcher::run).isInstanceOf(IllegalStateException.class);

        assertThat(drain(queue)).containsExactly(ProcessingMessage.shutdown());
        assertThat(dispatcher.state()).isEqualTo(DispatcherState.STOPPED);
    }
}
