package com.solstream.producer.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.solstream.producer.pipeline.FormatFailurePolicy;
import com.solstream.producer.subscription.FilterSpec;

@JsonIgnoreProperties(ignoreUnknown = true)
public class FeedSettings {

    public static final int DEFAULT_QUEUE_CAPACITY = 50_000;

    @JsonProperty("endpoint")                  public String     endpoint;
    @JsonProperty("x_token")                   public String     xToken;
    @JsonProperty("max_decoding_message_size") public long       maxDecodingMessageSize;
    @JsonProperty("commitment")                public String     commitment;
    @JsonProperty("filters")                   public FilterSpec filters = new FilterSpec();
    @JsonProperty("format")                    public String     format = "json";
    @JsonProperty("metrics")                   public MetricsSettings metrics = new MetricsSettings();
    @JsonProperty("topic_name")                public String     topicName;

    @JsonProperty("rpc_endpoint")              public String     rpcEndpoint;
    @JsonProperty("queue_capacity")            public int        queueCapacity = DEFAULT_QUEUE_CAPACITY;
    @JsonProperty("format_failure_policy")     public FormatFailurePolicy formatFailurePolicy = FormatFailurePolicy.PUBLISH_EMPTY;
    @JsonProperty("dead_letter_topic")         public String     deadLetterTopic;

    public String deadLetterTopicOrDefault() {
        return deadLetterTopic == null ? topicName + "-dlq" : deadLetterTopic;
    }
}
