package com.solstream.producer.rpc;

import com.solstream.producer.subscription.CommitmentLevel;

import java.io.IOException;

public interface WatermarkClient {

    long getSlot(CommitmentLevel level) throws IOException, InterruptedException;
}
