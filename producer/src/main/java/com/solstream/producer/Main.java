package com.solstream.producer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.solstream.producer.config.ConfigLoader;
import com.solstream.producer.config.FeedSettings;
import com.solstream.producer.config.MetricsSettings;
import com.solstream.producer.format.MessageFormatter;
import com.solstream.producer.format.UiTransactionEncoder;
import com.solstream.producer.health.HealthServer;
import com.solstream.producer.kafka.KafkaRecordPublisher;
import com.solstream.producer.kafka.TopicProvisioner;
import com.solstream.producer.metrics.BetterStackMetricsSink;
import com.solstream.producer.metrics.MetricsRegistry;
import com.solstream.producer.metrics.MetricsReporter;
import com.solstream.producer.pipeline.FormatFailurePolicy;
import com.solstream.producer.pipeline.LagSampler;
import com.solstream.producer.pipeline.ProcessTerminator;
import com.solstream.producer.pipeline.ProcessingQueue;
import com.solstream.producer.pipeline.PublishWorker;
import com.solstream.producer.pipeline.StreamDispatcher;
import com.solstream.producer.rpc.RpcWatermarkClient;
import com.solstream.producer.subscription.CommitmentLevel;
import com.solstream.producer.subscription.ConfigException;
import com.solstream.producer.subscription.FilterConfigBuilder;
import com.solstream.producer.subscription.SubscriptionRequest;
import com.solstream.producer.ws.WebSocketUpdateSource;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK      = 0;
    static final int EXIT_FAILURE = 1;

    public static void main(String[] args) throws Exception {
        System.exit(run(new Config()));
    }

    static int run(Config config) throws InterruptedException {
        log.info("producer.starting config={} kafka={}", config.configPath, config.bootstrapServers);

        ObjectMapper mapper = new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

        FeedSettings        feed;
        SubscriptionRequest request;
        try {
            feed    = new ConfigLoader().load(Path.of(config.configPath));
            request = new FilterConfigBuilder(mapper).build(feed.filters, CommitmentLevel.parse(feed.commitment));
        } catch (ConfigException e) {
            log.error("producer.config_failed kind={} category={} error={}", e.kind(), e.category(), e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            provisionTopics(config, feed);
        } catch (ExecutionException e) {
            log.error("producer.topic_setup_failed topic={} error={}", feed.topicName, e.getMessage());
            return EXIT_FAILURE;
        }

        MetricsRegistry metrics  = new MetricsRegistry();
        MetricsReporter reporter = startReporter(metrics, feed.metrics, mapper);

        KafkaRecordPublisher  publisher = new KafkaRecordPublisher(config, feed.topicName, feed.deadLetterTopicOrDefault(), mapper);
        WebSocketUpdateSource source    = new WebSocketUpdateSource(feed, mapper);
        try {
            source.subscribe(request);
        } catch (IOException e) {
            log.error("producer.subscribe_failed endpoint={} error={}", feed.endpoint, e.getMessage());
            publisher.close();
            if (reporter != null) reporter.shutdown();
            return EXIT_FAILURE;
        }

        ProcessingQueue queue = new ProcessingQueue(feed.queueCapacity);
        LagSampler lagSampler = feed.rpcEndpoint == null
                ? LagSampler.disabled()
                : new LagSampler(new RpcWatermarkClient(feed.rpcEndpoint, mapper));
        StreamDispatcher dispatcher = new StreamDispatcher(source, queue, lagSampler, metrics);

        AtomicBoolean fatal = new AtomicBoolean(false);
        ProcessTerminator terminator = status -> {
            fatal.set(true);
            ProcessTerminator.SYSTEM_EXIT.terminate(status);
        };
        MessageFormatter formatter = new MessageFormatter(mapper, new UiTransactionEncoder(mapper));
        PublishWorker    worker    = new PublishWorker(queue, formatter, publisher, metrics,
                feed.formatFailurePolicy, terminator);
        Thread workerThread = new Thread(worker, "publish-worker");

        HealthServer health = startHealth(config, metrics, dispatcher);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("producer.shutting_down");
            source.close();
            if (!fatal.get()) {
                try {
                    workerThread.join(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            log.info("producer.stopped");
        }, "shutdown-hook"));

        workerThread.start();
        dispatcher.run();
        workerThread.join();

        publisher.close();
        source.close();
        if (reporter != null) reporter.shutdown();
        if (health != null) health.stop();
        log.info("producer.finished published={}", worker.published());
        return EXIT_OK;
    }

    private static void provisionTopics(Config config, FeedSettings feed) throws ExecutionException, InterruptedException {
        Properties props = new Properties();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.bootstrapServers);
        try (Admin admin = Admin.create(props)) {
            TopicProvisioner provisioner = new TopicProvisioner(admin);
            provisioner.ensureTopicExists(feed.topicName);
            if (feed.formatFailurePolicy == FormatFailurePolicy.DEAD_LETTER) {
                provisioner.ensureTopicExists(feed.deadLetterTopicOrDefault());
            }
        }
    }

    private static MetricsReporter startReporter(MetricsRegistry metrics, MetricsSettings settings, ObjectMapper mapper) {
        if (!settings.isEnabled()) {
            log.info("metrics.disabled");
            return null;
        }
        log.info("metrics.enabled endpoint={}", settings.endpointOrDefault());
        MetricsReporter reporter = new MetricsReporter(metrics,
                new BetterStackMetricsSink(settings.endpointOrDefault(), settings.apiTokenOrDefault(), mapper),
                settings.intervalOrDefault());
        reporter.start();
        return reporter;
    }

    private static HealthServer startHealth(Config config, MetricsRegistry metrics, StreamDispatcher dispatcher) {
        try {
            return new HealthServer(config.healthPort, metrics, dispatcher::state);
        } catch (IOException e) {
            log.warn("health.unavailable port={} error={}", config.healthPort, e.getMessage());
            return null;
        }
    }
}
