package com.solstream.producer.pipeline;

@FunctionalInterface
public interface ProcessTerminator {

    ProcessTerminator SYSTEM_EXIT = System::exit;

    void terminate(int status);
}
