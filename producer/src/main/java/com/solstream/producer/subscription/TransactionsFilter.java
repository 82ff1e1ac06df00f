package com.solstream.producer.subscription;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TransactionsFilter {

    public final Boolean      vote;
    public final Boolean      failed;
    public final String       signature;
    public final List<String> accountInclude;
    public final List<String> accountExclude;
    public final List<String> accountRequired;

    public TransactionsFilter(Boolean vote, Boolean failed, String signature,
                              List<String> accountInclude, List<String> accountExclude,
                              List<String> accountRequired) {
        this.vote            = vote;
        this.failed          = failed;
        this.signature       = signature;
        this.accountInclude  = List.copyOf(accountInclude);
        this.accountExclude  = List.copyOf(accountExclude);
        this.accountRequired = List.copyOf(accountRequired);
    }
}
