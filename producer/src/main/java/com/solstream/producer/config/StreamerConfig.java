package com.solstream.producer.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamerConfig {

    @JsonProperty("yellowstone_grpc")
    public FeedSettings feed;
}
