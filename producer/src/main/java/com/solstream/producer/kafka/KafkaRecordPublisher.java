package com.solstream.producer.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solstream.producer.Config;
import com.solstream.producer.model.CanonicalRecord;
import com.solstream.producer.model.DeadLetter;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.ExecutionException;

public class KafkaRecordPublisher implements RecordPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaRecordPublisher.class);

    private final Producer<String, String> producer;
    private final String                   topic;
    private final String                   dlqTopic;
    private final ObjectMapper             mapper;

    public KafkaRecordPublisher(Config config, String topic, String dlqTopic, ObjectMapper mapper) {
        this(new KafkaProducer<>(producerProperties(config)), topic, dlqTopic, mapper);
    }

    KafkaRecordPublisher(Producer<String, String> producer, String topic, String dlqTopic, ObjectMapper mapper) {
        this.producer = producer;
        this.topic    = topic;
        this.dlqTopic = dlqTopic;
        this.mapper   = mapper;
    }

    static Properties producerProperties(Config config) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG,      config.bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG,   StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG,                   "all");
        // failures surface to the worker, which exits; the client must not retry behind its back
        props.put(ProducerConfig.RETRIES_CONFIG,                0);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG,     false);
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 1);
        props.put(ProducerConfig.LINGER_MS_CONFIG,              config.kafkaLingerMs);
        return props;
    }

    @Override
    public void publish(CanonicalRecord record) throws PublishException {
        String json;
        try {
            json = mapper.writeValueAsString(record.payload);
        } catch (JsonProcessingException e) {
            throw new PublishException("cannot serialize record " + record.key, e);
        }
        send(new ProducerRecord<>(topic, record.key, json));
    }

    @Override
    public void publishDeadLetter(DeadLetter letter) throws PublishException {
        String json;
        try {
            json = mapper.writeValueAsString(letter);
        } catch (JsonProcessingException e) {
            throw new PublishException("cannot serialize dead letter " + letter.key, e);
        }
        send(new ProducerRecord<>(dlqTopic, letter.key, json));
        log.warn("kafka.dead_lettered topic={} key={} kind={}", dlqTopic, letter.key, letter.kind);
    }

    private void send(ProducerRecord<String, String> record) throws PublishException {
        try {
            producer.send(record).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException("interrupted while publishing to " + record.topic(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new PublishException("delivery to " + record.topic() + " failed: " + cause.getMessage(), cause);
        } catch (RuntimeException e) {
            throw new PublishException("delivery to " + record.topic() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        producer.flush();
        producer.close(Duration.ofSeconds(10));
    }
}
