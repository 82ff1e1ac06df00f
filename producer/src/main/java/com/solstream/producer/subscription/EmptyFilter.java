package com.solstream.producer.subscription;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EmptyFilter {

    public static final EmptyFilter INSTANCE = new EmptyFilter();

    private EmptyFilter() {
    }
}
