package com.solstream.producer.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One update delivered by the upstream feed. The set of variants is closed: the constructor is
 * private and every variant is nested here. Consumers go through {@link Visitor}, so a new
 * upstream kind breaks every consumer at compile time until it is handled.
 */
public abstract class UpdateEnvelope {

    private UpdateEnvelope() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitAccount(Account update);
        R visitSlot(Slot update);
        R visitTransaction(Transaction update);
        R visitTransactionStatus(TransactionStatus update);
        R visitEntry(Entry update);
        R visitBlock(Block update);
        R visitBlockMeta(BlockMeta update);
        R visitPing(Ping update);
        R visitPong(Pong update);
    }

    // ── Accounts ──────────────────────────────────────────────────────────────

    public static final class Account extends UpdateEnvelope {
        public final long        slot;
        public final boolean     isStartup;
        /** May be {@code null} when the feed omits the account body. */
        public final AccountInfo account;

        public Account(long slot, boolean isStartup, AccountInfo account) {
            this.slot      = slot;
            this.isStartup = isStartup;
            this.account   = account;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitAccount(this); }
    }

    public static final class AccountInfo {
        public final byte[]  pubkey;
        public final long    lamports;
        public final byte[]  owner;
        public final boolean executable;
        public final long    rentEpoch;
        public final byte[]  data;
        public final long    writeVersion;
        public final byte[]  txnSignature;

        public AccountInfo(byte[] pubkey, long lamports, byte[] owner, boolean executable,
                           long rentEpoch, byte[] data, long writeVersion, byte[] txnSignature) {
            this.pubkey       = pubkey;
            this.lamports     = lamports;
            this.owner        = owner;
            this.executable   = executable;
            this.rentEpoch    = rentEpoch;
            this.data         = data;
            this.writeVersion = writeVersion;
            this.txnSignature = txnSignature;
        }
    }

    // ── Slots ─────────────────────────────────────────────────────────────────

    public static final class Slot extends UpdateEnvelope {
        public final long   slot;
        public final Long   parent;
        /** Raw status name as sent by the feed, e.g. {@code SLOT_CONFIRMED}. */
        public final String status;

        public Slot(long slot, Long parent, String status) {
            this.slot   = slot;
            this.parent = parent;
            this.status = status;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSlot(this); }
    }

    // ── Transactions ──────────────────────────────────────────────────────────

    public static final class Transaction extends UpdateEnvelope {
        public final long            slot;
        /** May be {@code null}; such an update has no signature and cannot be keyed. */
        public final TransactionInfo transaction;

        public Transaction(long slot, TransactionInfo transaction) {
            this.slot        = slot;
            this.transaction = transaction;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitTransaction(this); }
    }

    public static final class TransactionInfo {
        public final byte[]   signature;
        public final boolean  isVote;
        public final long     index;
        public final JsonNode transaction;
        public final JsonNode meta;

        public TransactionInfo(byte[] signature, boolean isVote, long index,
                               JsonNode transaction, JsonNode meta) {
            this.signature   = signature;
            this.isVote      = isVote;
            this.index       = index;
            this.transaction = transaction;
            this.meta        = meta;
        }
    }

    public static final class TransactionStatus extends UpdateEnvelope {
        public final long     slot;
        public final byte[]   signature;
        public final boolean  isVote;
        public final long     index;
        public final JsonNode err;

        public TransactionStatus(long slot, byte[] signature, boolean isVote, long index, JsonNode err) {
            this.slot      = slot;
            this.signature = signature;
            this.isVote    = isVote;
            this.index     = index;
            this.err       = err;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitTransactionStatus(this); }
    }

    // ── Entries / blocks ──────────────────────────────────────────────────────

    public static final class Entry extends UpdateEnvelope {
        public final long   slot;
        public final long   index;
        public final long   numHashes;
        public final byte[] hash;
        public final long   executedTransactionCount;

        public Entry(long slot, long index, long numHashes, byte[] hash, long executedTransactionCount) {
            this.slot                     = slot;
            this.index                    = index;
            this.numHashes                = numHashes;
            this.hash                     = hash;
            this.executedTransactionCount = executedTransactionCount;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitEntry(this); }
    }

    public static final class Block extends UpdateEnvelope {
        public final long     slot;
        public final String   blockhash;
        /** Full block body as received; not interpreted by the pipeline. */
        public final JsonNode body;

        public Block(long slot, String blockhash, JsonNode body) {
            this.slot      = slot;
            this.blockhash = blockhash;
            this.body      = body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitBlock(this); }
    }

    public static final class BlockMeta extends UpdateEnvelope {
        public final long     slot;
        public final String   blockhash;
        public final JsonNode rewards;
        public final Long     blockTime;
        public final Long     blockHeight;
        public final long     parentSlot;
        public final String   parentBlockhash;
        public final long     executedTransactionCount;
        public final long     entriesCount;

        public BlockMeta(long slot, String blockhash, JsonNode rewards, Long blockTime, Long blockHeight,
                         long parentSlot, String parentBlockhash, long executedTransactionCount,
                         long entriesCount) {
            this.slot                     = slot;
            this.blockhash                = blockhash;
            this.rewards                  = rewards;
            this.blockTime                = blockTime;
            this.blockHeight              = blockHeight;
            this.parentSlot               = parentSlot;
            this.parentBlockhash          = parentBlockhash;
            this.executedTransactionCount = executedTransactionCount;
            this.entriesCount             = entriesCount;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitBlockMeta(this); }
    }

    // ── Control ───────────────────────────────────────────────────────────────

    public static final class Ping extends UpdateEnvelope {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitPing(this); }
    }

    public static final class Pong extends UpdateEnvelope {
        public final int id;

        public Pong(int id) {
            this.id = id;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitPong(this); }
    }
}
