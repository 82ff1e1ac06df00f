package com.solstream.producer.kafka;

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.CreateTopicsResult;
import org.apache.kafka.clients.admin.ListTopicsResult;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.KafkaFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collection;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TopicProvisioner")
class TopicProvisionerTest {

    @Mock
    private Admin admin;

    @Mock
    private ListTopicsResult listing;

    @BeforeEach
    void setUp() {
        when(admin.listTopics()).thenReturn(listing);
    }

    @Test
    @DisplayName("leaves an existing topic alone")
    void existing() throws Exception {
        when(listing.names()).thenReturn(KafkaFuture.completedFuture(Set.of("solana.txs")));

        assertThat(new TopicProvisioner(admin).ensureTopicExists("solana.txs")).isFalse();
        verify(admin, never()).createTopics(anyCollection());
    }

    @Test
    @DisplayName("creates a missing topic with one partition")
    void missing() throws Exception {
        when(listing.names()).thenReturn(KafkaFuture.completedFuture(Set.of("other")));
        CreateTopicsResult created = mock(CreateTopicsResult.class);
        when(created.all()).thenReturn(KafkaFuture.completedFuture(null));
        when(admin.createTopics(anyCollection())).thenReturn(created);

        assertThat(new TopicProvisioner(admin).ensureTopicExists("solana.txs")).isTrue();
        verify(admin).createTopics(argThat((Collection<NewTopic> topics) -> {
            NewTopic topic = topics.iterator().next();
            return topics.size() == 1 && topic.name().equals("solana.txs") && topic.numPartitions() == 1;
        }));
    }
}
