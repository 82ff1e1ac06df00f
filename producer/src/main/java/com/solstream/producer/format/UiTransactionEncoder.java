package com.solstream.producer.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.solstream.producer.model.UpdateEnvelope;

public class UiTransactionEncoder implements TransactionEncoder {

    private final ObjectMapper mapper;

    public UiTransactionEncoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public ObjectNode encode(UpdateEnvelope.TransactionInfo info) throws FormatException {
        JsonNode tx = info.transaction;
        if (tx == null || !tx.isObject()) {
            throw new FormatException(FormatException.Kind.DECODE_FAILURE, "transaction body is not an object");
        }
        if (info.signature == null || info.signature.length == 0) {
            throw FormatException.missingField("signature");
        }

        ObjectNode out = mapper.createObjectNode();
        out.put("signature", Base58.encode(info.signature));
        out.put("isVote", info.isVote);
        out.put("index", info.index);
        out.set("transaction", tx.deepCopy());
        out.set("meta", info.meta == null ? out.nullNode() : info.meta.deepCopy());
        if (tx.path("message").path("versioned").asBoolean(false)) {
            out.put("version", 0);
        } else {
            out.put("version", "legacy");
        }
        return out;
    }
}
