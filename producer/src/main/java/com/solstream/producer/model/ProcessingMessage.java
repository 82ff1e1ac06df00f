package com.solstream.producer.model;

/**
 * Unit of work on the queue between the stream dispatcher and the publish worker.
 * {@link Kind#SHUTDOWN} is the sentinel the dispatcher enqueues after it stops reading.
 */
public final class ProcessingMessage {

    public enum Kind { TRANSACTION, BLOCK_METADATA, SHUTDOWN }

    private static final ProcessingMessage SHUTDOWN = new ProcessingMessage(Kind.SHUTDOWN, null, null);

    private final Kind                       kind;
    private final UpdateEnvelope.Transaction transaction;
    private final UpdateEnvelope.BlockMeta   blockMeta;

    private ProcessingMessage(Kind kind, UpdateEnvelope.Transaction transaction,
                              UpdateEnvelope.BlockMeta blockMeta) {
        this.kind        = kind;
        this.transaction = transaction;
        this.blockMeta   = blockMeta;
    }

    public static ProcessingMessage transaction(UpdateEnvelope.Transaction update) {
        return new ProcessingMessage(Kind.TRANSACTION, update, null);
    }

    public static ProcessingMessage blockMetadata(UpdateEnvelope.BlockMeta update) {
        return new ProcessingMessage(Kind.BLOCK_METADATA, null, update);
    }

    public static ProcessingMessage shutdown() {
        return SHUTDOWN;
    }

    public Kind kind() { return kind; }

    public UpdateEnvelope.Transaction transaction() {
        if (kind != Kind.TRANSACTION) throw new IllegalStateException("not a transaction: " + kind);
        return transaction;
    }

    public UpdateEnvelope.BlockMeta blockMeta() {
        if (kind != Kind.BLOCK_METADATA) throw new IllegalStateException("not block metadata: " + kind);
        return blockMeta;
    }

    public long slot() {
        switch (kind) {
            case TRANSACTION:    return transaction.slot;
            case BLOCK_METADATA: return blockMeta.slot;
            default: throw new IllegalStateException("shutdown carries no slot");
        }
    }

    @Override
    public String toString() {
        return "ProcessingMessage[" + kind + "]";
    }
}
