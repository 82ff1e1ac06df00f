package com.solstream.producer.metrics;

import java.util.concurrent.atomic.AtomicLong;

public class MetricsRegistry {

    public static final String TRANSACTIONS = "yellowstone_processed_transactions";
    public static final String ACCOUNTS     = "yellowstone_processed_accounts";
    public static final String ERRORS       = "yellowstone_errors";

    private final AtomicLong transactions = new AtomicLong(0);
    private final AtomicLong accounts     = new AtomicLong(0);
    private final AtomicLong errors       = new AtomicLong(0);

    public void incrementTransactions() { transactions.incrementAndGet(); }
    public void incrementAccounts()     { accounts.incrementAndGet(); }
    public void incrementErrors()       { errors.incrementAndGet(); }

    public long transactions() { return transactions.get(); }
    public long accounts()     { return accounts.get(); }
    public long errors()       { return errors.get(); }
}
