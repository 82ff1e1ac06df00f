package com.solstream.producer.subscription;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AccountsFilter {

    public final List<String>             account;
    public final List<String>             owner;
    public final List<AccountsFilterRule> filters;
    public final Boolean                  nonemptyTxnSignature;

    public AccountsFilter(List<String> account, List<String> owner,
                          List<AccountsFilterRule> filters, Boolean nonemptyTxnSignature) {
        this.account              = List.copyOf(account);
        this.owner                = List.copyOf(owner);
        this.filters              = List.copyOf(filters);
        this.nonemptyTxnSignature = nonemptyTxnSignature;
    }
}
