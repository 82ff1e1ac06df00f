package com.solstream.producer.subscription;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class DataSlice {

    @JsonIgnore public final long offset;
    @JsonIgnore public final long length;

    public DataSlice(long offset, long length) {
        this.offset = offset;
        this.length = length;
    }

    @JsonProperty("offset")
    String offsetJson() { return Long.toUnsignedString(offset); }

    @JsonProperty("length")
    String lengthJson() { return Long.toUnsignedString(length); }
}
