package com.solstream.producer.subscription;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SubscriptionRequest {

    public static final String FILTER_NAME = "client";

    public final Map<String, AccountsFilter>     accounts;
    public final Map<String, SlotsFilter>        slots;
    public final Map<String, TransactionsFilter> transactions;
    public final Map<String, TransactionsFilter> transactionsStatus;
    public final Map<String, EmptyFilter>        entry;
    public final Map<String, BlocksFilter>       blocks;
    public final Map<String, EmptyFilter>        blocksMeta;
    public final CommitmentLevel                 commitment;
    public final List<DataSlice>                 accountsDataSlice;

    @JsonIgnore
    public final Integer pingId;

    SubscriptionRequest(Map<String, AccountsFilter> accounts,
                        Map<String, SlotsFilter> slots,
                        Map<String, TransactionsFilter> transactions,
                        Map<String, TransactionsFilter> transactionsStatus,
                        Map<String, EmptyFilter> entry,
                        Map<String, BlocksFilter> blocks,
                        Map<String, EmptyFilter> blocksMeta,
                        CommitmentLevel commitment,
                        List<DataSlice> accountsDataSlice,
                        Integer pingId) {
        this.accounts           = freeze(accounts);
        this.slots              = freeze(slots);
        this.transactions       = freeze(transactions);
        this.transactionsStatus = freeze(transactionsStatus);
        this.entry              = freeze(entry);
        this.blocks             = freeze(blocks);
        this.blocksMeta         = freeze(blocksMeta);
        this.commitment         = commitment;
        this.accountsDataSlice  = List.copyOf(accountsDataSlice);
        this.pingId             = pingId;
    }

    @JsonProperty("ping")
    Map<String, Integer> pingJson() {
        return pingId == null ? null : Map.of("id", pingId);
    }

    private static <V> Map<String, V> freeze(Map<String, V> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
