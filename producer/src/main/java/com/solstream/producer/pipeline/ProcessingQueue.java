package com.solstream.producer.pipeline;

import com.solstream.producer.model.ProcessingMessage;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;

/** Bounded single-producer, single-consumer hand-off between the dispatcher and the publish worker. */
public class ProcessingQueue {

    private static final long POLL_MS = 100;

    private final ArrayBlockingQueue<ProcessingMessage> queue;
    private final int                                   capacity;
    private volatile boolean                            receiverClosed = false;

    public ProcessingQueue(int capacity) {
        this.queue    = new ArrayBlockingQueue<>(capacity);
        this.capacity = capacity;
    }

    public void put(ProcessingMessage message) throws InterruptedException {
        while (true) {
            if (receiverClosed) throw new ChannelClosedException();
            if (queue.offer(message, POLL_MS, TimeUnit.MILLISECONDS)) return;
        }
    }

    public boolean tryPut(ProcessingMessage message) {
        return !receiverClosed && queue.offer(message);
    }

    public ProcessingMessage take() throws InterruptedException {
        return queue.take();
    }

    public void closeReceiver() {
        receiverClosed = true;
    }

    public boolean isReceiverClosed() { return receiverClosed; }
    public int size()                 { return queue.size(); }
    public int capacity()             { return capacity; }
}
