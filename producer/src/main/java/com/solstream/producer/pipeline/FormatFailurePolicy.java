package com.solstream.producer.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum FormatFailurePolicy {
    PUBLISH_EMPTY,
    SKIP,
    DEAD_LETTER;

    @JsonCreator
    public static FormatFailurePolicy fromValue(String value) {
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
