package com.solstream.producer.format;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.solstream.producer.model.UpdateEnvelope;

public interface TransactionEncoder {

    ObjectNode encode(UpdateEnvelope.TransactionInfo transaction) throws FormatException;
}
