package com.solstream.producer.pipeline;

/** Moves forward only: RUNNING, then DRAINING, then STOPPED. */
public enum DispatcherState { RUNNING, DRAINING, STOPPED }
