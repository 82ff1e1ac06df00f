package com.solstream.producer.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically reports how much each counter grew since the previous tick. A failed report is
 * logged and the next tick runs as usual.
 */
public class MetricsReporter {

    private static final Logger log = LoggerFactory.getLogger(MetricsReporter.class);

    public static final long MIN_INTERVAL_SECONDS = 10;

    static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final MetricsRegistry metrics;
    private final MetricsSink     sink;
    private final long            intervalSeconds;
    private final Clock           clock;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "metrics-reporter");
        t.setDaemon(true);
        return t;
    });

    private long lastTransactions;
    private long lastAccounts;
    private long lastErrors;

    public MetricsReporter(MetricsRegistry metrics, MetricsSink sink, long intervalSeconds) {
        this(metrics, sink, intervalSeconds, Clock.systemUTC());
    }

    MetricsReporter(MetricsRegistry metrics, MetricsSink sink, long intervalSeconds, Clock clock) {
        this.metrics         = metrics;
        this.sink            = sink;
        this.intervalSeconds = Math.max(intervalSeconds, MIN_INTERVAL_SECONDS);
        this.clock           = clock;
    }

    public void start() {
        log.info("metrics.reporter_started interval_s={}", intervalSeconds);
        scheduler.scheduleAtFixedRate(this::tick, 0, intervalSeconds, TimeUnit.SECONDS);
    }

    public void shutdown() {
        scheduler.shutdownNow();
    }

    private void tick() {
        try {
            reportOnce();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("metrics.reporter_interrupted");
        } catch (RuntimeException e) {
            // an escaping exception would cancel the schedule
            log.error("metrics.tick_failed error={}", e.getMessage(), e);
        }
    }

    synchronized void reportOnce() throws InterruptedException {
        String timestamp = TIMESTAMP.format(clock.instant());

        long transactions = metrics.transactions();
        long accounts     = metrics.accounts();
        long errors       = metrics.errors();

        long transactionsDelta = delta(transactions, lastTransactions);
        long accountsDelta     = delta(accounts, lastAccounts);
        long errorsDelta       = delta(errors, lastErrors);

        lastTransactions = transactions;
        lastAccounts     = accounts;
        lastErrors       = errors;

        log.debug("metrics.report transactions={} accounts={} errors={}",
                transactionsDelta, accountsDelta, errorsDelta);

        send(MetricsRegistry.TRANSACTIONS, transactionsDelta, timestamp);
        send(MetricsRegistry.ACCOUNTS, accountsDelta, timestamp);
        send(MetricsRegistry.ERRORS, errorsDelta, timestamp);
    }

    private void send(String name, long value, String timestamp) throws InterruptedException {
        try {
            sink.send(name, value, timestamp);
        } catch (MetricsSinkException | RuntimeException e) {
            log.error("metrics.report_failed name={} error={}", name, e.getMessage());
        }
    }

    static long delta(long current, long previous) {
        return current >= previous ? current - previous : current;
    }

    public long intervalSeconds() {
        return intervalSeconds;
    }
}
