package com.solstream.producer.subscription;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AccountsFilterRule {

    public enum Type { MEMCMP, DATASIZE, TOKEN_ACCOUNT_STATE, LAMPORTS }

    @JsonIgnore public final Type   type;
    @JsonIgnore public final Long   memcmpOffset;
    @JsonIgnore public final String memcmpBase58;
    @JsonIgnore public final Long   datasizeBytes;
    @JsonIgnore public final Boolean tokenState;
    @JsonIgnore public final LamportsComparator lamportsCmp;
    @JsonIgnore public final Long   lamportsValue;

    private AccountsFilterRule(Type type, Long memcmpOffset, String memcmpBase58, Long datasizeBytes,
                               Boolean tokenState, LamportsComparator lamportsCmp,
                               Long lamportsValue) {
        this.type              = type;
        this.memcmpOffset      = memcmpOffset;
        this.memcmpBase58      = memcmpBase58;
        this.datasizeBytes     = datasizeBytes;
        this.tokenState        = tokenState;
        this.lamportsCmp       = lamportsCmp;
        this.lamportsValue     = lamportsValue;
    }

    public static AccountsFilterRule memcmp(long offset, String base58) {
        return new AccountsFilterRule(Type.MEMCMP, offset, base58, null, null, null, null);
    }

    public static AccountsFilterRule datasize(long size) {
        return new AccountsFilterRule(Type.DATASIZE, null, null, size, null, null, null);
    }

    public static AccountsFilterRule tokenAccountState(boolean state) {
        return new AccountsFilterRule(Type.TOKEN_ACCOUNT_STATE, null, null, null, state, null, null);
    }

    public static AccountsFilterRule lamports(LamportsComparator cmp, long value) {
        return new AccountsFilterRule(Type.LAMPORTS, null, null, null, null, cmp, value);
    }

    // ── wire form ────────────────────────────────────────────────────────────

    @JsonProperty("memcmp")
    Map<String, String> memcmpJson() {
        if (type != Type.MEMCMP) return null;
        return Map.of("offset", Long.toUnsignedString(memcmpOffset), "base58", memcmpBase58);
    }

    @JsonProperty("datasize")
    String datasizeJson() {
        return type == Type.DATASIZE ? Long.toUnsignedString(datasizeBytes) : null;
    }

    @JsonProperty("tokenAccountState")
    Boolean tokenAccountStateJson() {
        return type == Type.TOKEN_ACCOUNT_STATE ? tokenState : null;
    }

    @JsonProperty("lamports")
    Map<String, String> lamportsJson() {
        if (type != Type.LAMPORTS) return null;
        return Map.of(lamportsCmp.token(), Long.toUnsignedString(lamportsValue));
    }
}
