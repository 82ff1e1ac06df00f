package com.solstream.producer.ws;

import com.solstream.producer.model.UpdateEnvelope;
import com.solstream.producer.subscription.SubscriptionRequest;

import java.io.IOException;

public interface UpdateSource extends AutoCloseable {

    void subscribe(SubscriptionRequest request) throws IOException, InterruptedException;

    // null once the stream has ended
    UpdateEnvelope next() throws TransportException, InterruptedException;

    @Override
    void close();
}
