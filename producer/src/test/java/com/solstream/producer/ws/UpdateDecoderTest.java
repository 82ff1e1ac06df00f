package com.solstream.producer.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.solstream.producer.model.UpdateEnvelope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UpdateDecoder")
class UpdateDecoderTest {

    private final UpdateDecoder decoder = new UpdateDecoder(new ObjectMapper());

    @Test
    @DisplayName("decodes a transaction with string u64s and base64 signature")
    void transaction() throws Exception {
        UpdateEnvelope update = decoder.decode("{\"filters\":[\"client\"],\"transaction\":{\"slot\":\"18446744073709551615\","
                + "\"transaction\":{\"signature\":\"AQID\",\"isVote\":true,\"index\":\"4\","
                + "\"transaction\":{\"message\":{}},\"meta\":{\"fee\":\"5000\"}}}}");

        assertThat(update).isInstanceOf(UpdateEnvelope.Transaction.class);
        UpdateEnvelope.Transaction tx = (UpdateEnvelope.Transaction) update;
        assertThat(Long.toUnsignedString(tx.slot)).isEqualTo("18446744073709551615");
        assertThat(tx.transaction.signature).containsExactly(1, 2, 3);
        assertThat(tx.transaction.isVote).isTrue();
        assertThat(tx.transaction.index).isEqualTo(4);
        assertThat(tx.transaction.meta.get("fee").asText()).isEqualTo("5000");
    }

    @Test
    @DisplayName("block meta optional wrappers become null when absent")
    void blockMeta() throws Exception {
        UpdateEnvelope.BlockMeta meta = (UpdateEnvelope.BlockMeta) decoder.decode(
                "{\"blockMeta\":{\"slot\":\"100\",\"blockhash\":\"H\",\"parentSlot\":\"99\","
                        + "\"parentBlockhash\":\"P\",\"blockHeight\":{\"blockHeight\":\"90\"},\"entriesCount\":\"3\"}}");

        assertThat(meta.slot).isEqualTo(100);
        assertThat(meta.blockhash).isEqualTo("H");
        assertThat(meta.blockTime).isNull();
        assertThat(meta.blockHeight).isEqualTo(90L);
        assertThat(meta.rewards).isNull();
        assertThat(meta.executedTransactionCount).isZero();
        assertThat(meta.entriesCount).isEqualTo(3);
    }

    @Test
    @DisplayName("keepalive kinds decode to ping and pong")
    void keepalive() throws Exception {
        assertThat(decoder.decode("{\"ping\":{}}")).isInstanceOf(UpdateEnvelope.Ping.class);
        assertThat(((UpdateEnvelope.Pong) decoder.decode("{\"pong\":{\"id\":7}}")).id).isEqualTo(7);
    }

    @Test
    @DisplayName("slot updates keep the raw status name")
    void slot() throws Exception {
        UpdateEnvelope.Slot slot = (UpdateEnvelope.Slot) decoder.decode(
                "{\"slot\":{\"slot\":\"5\",\"parent\":\"4\",\"status\":\"SLOT_CONFIRMED\"}}");

        assertThat(slot.parent).isEqualTo(4L);
        assertThat(slot.status).isEqualTo("SLOT_CONFIRMED");
    }

    @Test
    @DisplayName("rejects frames that are not updates")
    void rejects() {
        assertThatThrownBy(() -> decoder.decode("not json")).isInstanceOf(TransportException.class);
        assertThatThrownBy(() -> decoder.decode("{\"createdAt\":\"2024\"}"))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("createdAt");
        assertThatThrownBy(() -> decoder.decode("{\"slot\":{\"slot\":\"-1x\"}}")).isInstanceOf(TransportException.class);
    }
}
