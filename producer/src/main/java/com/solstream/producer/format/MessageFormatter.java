package com.solstream.producer.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.solstream.producer.model.UpdateEnvelope;
import com.solstream.producer.subscription.CommitmentLevel;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Pure per-kind conversion of upstream updates into canonical JSON payloads.
 */
public class MessageFormatter {

    public static final long EPOCH_SIZE = 432_000L;

    private final ObjectMapper       mapper;
    private final TransactionEncoder encoder;

    public MessageFormatter(ObjectMapper mapper, TransactionEncoder encoder) {
        this.mapper  = mapper;
        this.encoder = encoder;
    }

    public static long epochOf(long slot) {
        return Long.divideUnsigned(slot, EPOCH_SIZE);
    }

    public static String transactionKey(UpdateEnvelope.Transaction update) throws FormatException {
        if (update.transaction == null) throw FormatException.missingField("transaction");
        byte[] signature = update.transaction.signature;
        if (signature == null || signature.length == 0) throw FormatException.missingField("signature");
        return Base58.encode(signature);
    }

    public static String blockMetaKey(UpdateEnvelope.BlockMeta update) throws FormatException {
        if (update.blockhash == null || update.blockhash.isEmpty()) throw FormatException.missingField("blockhash");
        return Base58.encode(update.blockhash.getBytes(StandardCharsets.UTF_8));
    }

    public ObjectNode formatTransaction(UpdateEnvelope.Transaction update) throws FormatException {
        if (update.transaction == null) throw FormatException.missingField("transaction");

        ObjectNode value = encoder.encode(update.transaction);
        value.put("slot", update.slot);
        value.put("epoch", epochOf(update.slot));
        return value;
    }

    public ObjectNode formatBlockMeta(UpdateEnvelope.BlockMeta update) {
        ObjectNode value = mapper.createObjectNode();
        value.put("slot", update.slot);
        value.put("blockhash", update.blockhash);
        value.set("rewards", update.rewards == null ? value.nullNode() : update.rewards.deepCopy());
        if (update.blockTime == null) value.putNull("blockTime");
        else value.put("blockTime", update.blockTime);
        if (update.blockHeight == null) value.putNull("blockHeight");
        else value.put("blockHeight", update.blockHeight);
        value.put("parentSlot", update.parentSlot);
        value.put("parentBlockhash", update.parentBlockhash);
        value.put("executedTransactionCount", update.executedTransactionCount);
        value.put("entriesCount", update.entriesCount);
        return value;
    }

    public ObjectNode formatAccount(UpdateEnvelope.Account update) throws FormatException {
        UpdateEnvelope.AccountInfo info = update.account;
        if (info == null) throw FormatException.missingField("account");

        ObjectNode value = mapper.createObjectNode();
        value.put("pubkey", Base58.encode(info.pubkey));
        value.put("lamports", info.lamports);
        value.put("owner", Base58.encode(info.owner));
        value.put("rent_epoch", info.rentEpoch);
        value.put("slot", update.slot);
        value.put("data", Base64.getEncoder().encodeToString(info.data));
        if (info.txnSignature == null) value.putNull("txn_signature");
        else value.put("txn_signature", Base58.encode(info.txnSignature));
        return value;
    }

    public ObjectNode formatSlot(UpdateEnvelope.Slot update) throws FormatException {
        CommitmentLevel status = CommitmentLevel.lookup(update.status);
        if (status == null) {
            throw new FormatException(FormatException.Kind.DECODE_FAILURE,
                    "failed to decode commitment '" + update.status + "'");
        }
        ObjectNode value = mapper.createObjectNode();
        value.put("slot", update.slot);
        value.put("status", status.name());
        return value;
    }
}
