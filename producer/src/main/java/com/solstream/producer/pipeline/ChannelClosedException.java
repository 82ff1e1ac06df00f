package com.solstream.producer.pipeline;

/** The consuming side of a {@link ProcessingQueue} has stopped. */
public class ChannelClosedException extends RuntimeException {

    public ChannelClosedException() {
        super("processing queue receiver is closed");
    }
}
