package com.solstream.producer.kafka;

import com.solstream.producer.model.CanonicalRecord;
import com.solstream.producer.model.DeadLetter;

public interface RecordPublisher extends AutoCloseable {

    void publish(CanonicalRecord record) throws PublishException;

    void publishDeadLetter(DeadLetter letter) throws PublishException;

    @Override
    void close();
}
