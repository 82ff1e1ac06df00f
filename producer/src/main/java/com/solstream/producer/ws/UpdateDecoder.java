package com.solstream.producer.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solstream.producer.model.UpdateEnvelope;

import java.util.Base64;
import java.util.Iterator;

public class UpdateDecoder {

    private final ObjectMapper mapper;

    public UpdateDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public UpdateEnvelope decode(String raw) throws TransportException {
        JsonNode root;
        try {
            root = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new TransportException("update is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new TransportException("update is not a JSON object");
        }
        return decode(root);
    }

    public UpdateEnvelope decode(JsonNode root) throws TransportException {
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            JsonNode body = root.get(name);
            switch (name) {
                case "account":           return account(body);
                case "slot":              return slot(body);
                case "transaction":       return transaction(body);
                case "transactionStatus": return transactionStatus(body);
                case "entry":             return entry(body);
                case "block":             return block(body);
                case "blockMeta":         return blockMeta(body);
                case "ping":              return new UpdateEnvelope.Ping();
                case "pong":              return new UpdateEnvelope.Pong(body.path("id").asInt());
                default:                  break; // filters, createdAt
            }
        }
        throw new TransportException("update carries no known payload, fields=" + fieldList(root));
    }

    private UpdateEnvelope.Account account(JsonNode body) throws TransportException {
        JsonNode info = body.get("account");
        UpdateEnvelope.AccountInfo account = null;
        if (info != null && !info.isNull()) {
            account = new UpdateEnvelope.AccountInfo(
                    bytes(info, "pubkey"),
                    u64(info, "lamports"),
                    bytes(info, "owner"),
                    info.path("executable").asBoolean(false),
                    u64(info, "rentEpoch"),
                    bytes(info, "data"),
                    u64(info, "writeVersion"),
                    optionalBytes(info, "txnSignature"));
        }
        return new UpdateEnvelope.Account(u64(body, "slot"), body.path("isStartup").asBoolean(false), account);
    }

    private UpdateEnvelope.Slot slot(JsonNode body) throws TransportException {
        Long parent = body.hasNonNull("parent") ? u64(body, "parent") : null;
        return new UpdateEnvelope.Slot(u64(body, "slot"), parent, body.path("status").asText(""));
    }

    private UpdateEnvelope.Transaction transaction(JsonNode body) throws TransportException {
        JsonNode info = body.get("transaction");
        UpdateEnvelope.TransactionInfo tx = null;
        if (info != null && !info.isNull()) {
            tx = new UpdateEnvelope.TransactionInfo(
                    bytes(info, "signature"),
                    info.path("isVote").asBoolean(false),
                    u64(info, "index"),
                    info.get("transaction"),
                    info.get("meta"));
        }
        return new UpdateEnvelope.Transaction(u64(body, "slot"), tx);
    }

    private UpdateEnvelope.TransactionStatus transactionStatus(JsonNode body) throws TransportException {
        return new UpdateEnvelope.TransactionStatus(
                u64(body, "slot"),
                bytes(body, "signature"),
                body.path("isVote").asBoolean(false),
                u64(body, "index"),
                body.get("err"));
    }

    private UpdateEnvelope.Entry entry(JsonNode body) throws TransportException {
        return new UpdateEnvelope.Entry(
                u64(body, "slot"),
                u64(body, "index"),
                u64(body, "numHashes"),
                bytes(body, "hash"),
                u64(body, "executedTransactionCount"));
    }

    private UpdateEnvelope.Block block(JsonNode body) throws TransportException {
        return new UpdateEnvelope.Block(u64(body, "slot"), body.path("blockhash").asText(""), body);
    }

    private UpdateEnvelope.BlockMeta blockMeta(JsonNode body) throws TransportException {
        JsonNode rewards = body.get("rewards");
        Long blockTime = body.path("blockTime").hasNonNull("timestamp")
                ? u64(body.get("blockTime"), "timestamp") : null;
        Long blockHeight = body.path("blockHeight").hasNonNull("blockHeight")
                ? u64(body.get("blockHeight"), "blockHeight") : null;
        return new UpdateEnvelope.BlockMeta(
                u64(body, "slot"),
                body.path("blockhash").asText(""),
                rewards == null || rewards.isNull() ? null : rewards,
                blockTime,
                blockHeight,
                u64(body, "parentSlot"),
                body.path("parentBlockhash").asText(""),
                u64(body, "executedTransactionCount"),
                u64(body, "entriesCount"));
    }

    // ── scalar helpers ────────────────────────────────────────────────────────

    private static long u64(JsonNode node, String field) throws TransportException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return 0L;
        if (value.isIntegralNumber()) return value.asLong();
        try {
            return Long.parseUnsignedLong(value.asText());
        } catch (NumberFormatException e) {
            throw new TransportException("field " + field + " is not an unsigned integer: " + value.asText(), e);
        }
    }

    private static byte[] bytes(JsonNode node, String field) throws TransportException {
        byte[] value = optionalBytes(node, field);
        return value == null ? new byte[0] : value;
    }

    private static byte[] optionalBytes(JsonNode node, String field) throws TransportException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        try {
            return Base64.getDecoder().decode(value.asText());
        } catch (IllegalArgumentException e) {
            throw new TransportException("field " + field + " is not base64", e);
        }
    }

    private static String fieldList(JsonNode root) {
        StringBuilder sb = new StringBuilder("[");
        root.fieldNames().forEachRemaining(n -> sb.append(sb.length() > 1 ? "," : "").append(n));
        return sb.append(']').toString();
    }
}
