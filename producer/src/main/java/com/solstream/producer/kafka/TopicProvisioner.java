package com.solstream.producer.kafka;

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.NewTopic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;

public class TopicProvisioner {

    private static final Logger log = LoggerFactory.getLogger(TopicProvisioner.class);

    private static final int   PARTITIONS  = 1;
    private static final short REPLICATION = 1;

    private final Admin admin;

    public TopicProvisioner(Admin admin) {
        this.admin = admin;
    }

    public boolean ensureTopicExists(String topic) throws ExecutionException, InterruptedException {
        Set<String> existing = admin.listTopics().names().get();
        if (existing.contains(topic)) {
            log.info("kafka.topic_exists topic={}", topic);
            return false;
        }
        log.info("kafka.topic_creating topic={} partitions={} replication={}", topic, PARTITIONS, REPLICATION);
        admin.createTopics(List.of(new NewTopic(topic, PARTITIONS, REPLICATION))).all().get();
        log.info("kafka.topic_created topic={}", topic);
        return true;
    }
}
