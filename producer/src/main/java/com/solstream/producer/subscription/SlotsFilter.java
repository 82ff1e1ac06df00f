package com.solstream.producer.subscription;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SlotsFilter {

    public final Boolean filterByCommitment;

    public SlotsFilter(boolean filterByCommitment) {
        this.filterByCommitment = filterByCommitment;
    }
}
