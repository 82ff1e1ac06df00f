package com.solstream.producer.subscription;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Declarative filter options from the {@code filters:} block of the config file.
 * Field names match the YAML keys. Every option is optional; an unset category flag
 * means the category is disabled.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FilterSpec {

    // ── Accounts ──────────────────────────────────────────────────────────────
    @JsonProperty("accounts")                       public Boolean      accounts;
    @JsonProperty("accounts_nonempty_txn_signature") public Boolean     accountsNonemptyTxnSignature;
    @JsonProperty("accounts_account")               public List<String> accountsAccount;
    /** Path to a JSON array of additional account addresses. */
    @JsonProperty("accounts_account_path")          public String       accountsAccountPath;
    @JsonProperty("accounts_owner")                 public List<String> accountsOwner;
    /** Entries of the form {@code offset,base58data}. */
    @JsonProperty("accounts_memcmp")                public List<String> accountsMemcmp;
    @JsonProperty("accounts_datasize")              public Long         accountsDatasize;
    @JsonProperty("accounts_token_account_state")   public Boolean      accountsTokenAccountState;
    /** Entries of the form {@code eq:42}, {@code ne:42}, {@code lt:42} or {@code gt:42}. */
    @JsonProperty("accounts_lamports")              public List<String> accountsLamports;
    /** Entries of the form {@code offset,length}. */
    @JsonProperty("accounts_data_slice")            public List<String> accountsDataSlice;

    // ── Slots ─────────────────────────────────────────────────────────────────
    @JsonProperty("slots")                          public Boolean      slots;
    @JsonProperty("slots_filter_by_commitment")     public Boolean      slotsFilterByCommitment;

    // ── Transactions ──────────────────────────────────────────────────────────
    @JsonProperty("transactions")                   public Boolean      transactions;
    @JsonProperty("transactions_vote")              public Boolean      transactionsVote;
    @JsonProperty("transactions_failed")            public Boolean      transactionsFailed;
    @JsonProperty("transactions_signature")         public String       transactionsSignature;
    @JsonProperty("transactions_account_include")   public List<String> transactionsAccountInclude;
    @JsonProperty("transactions_account_exclude")   public List<String> transactionsAccountExclude;
    @JsonProperty("transactions_account_required")  public List<String> transactionsAccountRequired;

    // ── Transaction status ────────────────────────────────────────────────────
    @JsonProperty("transactions_status")                  public Boolean      transactionsStatus;
    @JsonProperty("transactions_status_vote")             public Boolean      transactionsStatusVote;
    @JsonProperty("transactions_status_failed")           public Boolean      transactionsStatusFailed;
    @JsonProperty("transactions_status_signature")        public String       transactionsStatusSignature;
    @JsonProperty("transactions_status_account_include")  public List<String> transactionsStatusAccountInclude;
    @JsonProperty("transactions_status_account_exclude")  public List<String> transactionsStatusAccountExclude;
    @JsonProperty("transactions_status_account_required") public List<String> transactionsStatusAccountRequired;

    // ── Entries / blocks ──────────────────────────────────────────────────────
    @JsonProperty("entries")                        public Boolean      entries;
    @JsonProperty("blocks")                         public Boolean      blocks;
    @JsonProperty("blocks_account_include")         public List<String> blocksAccountInclude;
    @JsonProperty("blocks_include_transactions")    public Boolean      blocksIncludeTransactions;
    @JsonProperty("blocks_include_accounts")        public Boolean      blocksIncludeAccounts;
    @JsonProperty("blocks_include_entries")         public Boolean      blocksIncludeEntries;
    @JsonProperty("blocks_meta")                    public Boolean      blocksMeta;

    /** Keep-alive ping id sent with the request. */
    @JsonProperty("ping")                           public Integer      ping;
}
