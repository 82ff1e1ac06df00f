package com.solstream.producer.subscription;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BlocksFilter {

    public final List<String> accountInclude;
    public final Boolean      includeTransactions;
    public final Boolean      includeAccounts;
    public final Boolean      includeEntries;

    public BlocksFilter(List<String> accountInclude, Boolean includeTransactions,
                        Boolean includeAccounts, Boolean includeEntries) {
        this.accountInclude      = List.copyOf(accountInclude);
        this.includeTransactions = includeTransactions;
        this.includeAccounts     = includeAccounts;
        this.includeEntries      = includeEntries;
    }
}
