package com.solstream.producer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.solstream.producer.subscription.ConfigException;
import com.solstream.producer.subscription.FilterSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public FeedSettings load(Path path) throws ConfigException {
        String yaml;
        try {
            yaml = Files.readString(path);
        } catch (NoSuchFileException e) {
            throw ConfigException.io("config file not found: " + path, e);
        } catch (IOException e) {
            throw ConfigException.io("cannot read config file " + path, e);
        }

        StreamerConfig config;
        try {
            config = yamlMapper.readValue(yaml, StreamerConfig.class);
        } catch (IOException e) {
            throw ConfigException.parseSyntax("config file " + path + " is not valid: " + e.getMessage(), e);
        }
        if (config == null || config.feed == null) {
            throw ConfigException.parseSyntax("config file " + path + " has no yellowstone_grpc block", null);
        }

        FeedSettings feed = config.feed;
        require(feed.endpoint, "endpoint");
        require(feed.topicName, "topic_name");
        if (!"json".equals(feed.format == null ? null : feed.format.toLowerCase(Locale.ROOT))) {
            throw ConfigException.parseSyntax("unsupported output format: " + feed.format, null);
        }
        if (feed.queueCapacity <= 0) {
            throw ConfigException.parseSyntax("queue_capacity must be positive", null);
        }
        if (feed.filters == null) feed.filters = new FilterSpec();
        if (feed.metrics == null) feed.metrics = new MetricsSettings();

        log.info("config.loaded path={} endpoint={} topic={} commitment={} queue_capacity={} format_failure_policy={}",
                path, feed.endpoint, feed.topicName, feed.commitment, feed.queueCapacity, feed.formatFailurePolicy);
        return feed;
    }

    private static void require(String value, String field) throws ConfigException {
        if (value == null || value.isBlank()) {
            throw ConfigException.parseSyntax("missing required field yellowstone_grpc." + field, null);
        }
    }
}
