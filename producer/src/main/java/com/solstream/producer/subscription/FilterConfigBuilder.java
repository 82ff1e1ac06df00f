package com.solstream.producer.subscription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates {@link FilterSpec} into the {@link SubscriptionRequest} sent to the upstream feed.
 * The only I/O is reading the optional account address file.
 */
public class FilterConfigBuilder {

    private static final Logger log = LoggerFactory.getLogger(FilterConfigBuilder.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public FilterConfigBuilder() {
        this(new ObjectMapper());
    }

    public FilterConfigBuilder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public SubscriptionRequest build(FilterSpec spec, CommitmentLevel commitment) throws ConfigException {
        Map<String, AccountsFilter> accounts = new HashMap<>();
        if (isSet(spec.accounts)) {
            accounts.put(SubscriptionRequest.FILTER_NAME, buildAccounts(spec));
        }

        Map<String, SlotsFilter> slots = new HashMap<>();
        if (isSet(spec.slots)) {
            slots.put(SubscriptionRequest.FILTER_NAME, new SlotsFilter(isSet(spec.slotsFilterByCommitment)));
        }

        Map<String, TransactionsFilter> transactions = new HashMap<>();
        if (isSet(spec.transactions)) {
            transactions.put(SubscriptionRequest.FILTER_NAME, new TransactionsFilter(
                    spec.transactionsVote,
                    spec.transactionsFailed,
                    spec.transactionsSignature,
                    orEmpty(spec.transactionsAccountInclude),
                    orEmpty(spec.transactionsAccountExclude),
                    orEmpty(spec.transactionsAccountRequired)));
        }

        Map<String, TransactionsFilter> transactionsStatus = new HashMap<>();
        if (isSet(spec.transactionsStatus)) {
            transactionsStatus.put(SubscriptionRequest.FILTER_NAME, new TransactionsFilter(
                    spec.transactionsStatusVote,
                    spec.transactionsStatusFailed,
                    spec.transactionsStatusSignature,
                    orEmpty(spec.transactionsStatusAccountInclude),
                    orEmpty(spec.transactionsStatusAccountExclude),
                    orEmpty(spec.transactionsStatusAccountRequired)));
        }

        Map<String, EmptyFilter> entry = new HashMap<>();
        if (isSet(spec.entries)) {
            entry.put(SubscriptionRequest.FILTER_NAME, EmptyFilter.INSTANCE);
        }

        Map<String, BlocksFilter> blocks = new HashMap<>();
        if (isSet(spec.blocks)) {
            blocks.put(SubscriptionRequest.FILTER_NAME, new BlocksFilter(
                    orEmpty(spec.blocksAccountInclude),
                    spec.blocksIncludeTransactions,
                    spec.blocksIncludeAccounts,
                    spec.blocksIncludeEntries));
        }

        Map<String, EmptyFilter> blocksMeta = new HashMap<>();
        if (isSet(spec.blocksMeta)) {
            blocksMeta.put(SubscriptionRequest.FILTER_NAME, EmptyFilter.INSTANCE);
        }

        List<DataSlice> dataSlices = new ArrayList<>();
        for (String entryText : orEmpty(spec.accountsDataSlice)) {
            dataSlices.add(parseDataSlice(entryText));
        }

        SubscriptionRequest request = new SubscriptionRequest(accounts, slots, transactions,
                transactionsStatus, entry, blocks, blocksMeta, commitment, dataSlices, spec.ping);
        log.info("subscription.built accounts={} slots={} transactions={} transactions_status={} "
                        + "entries={} blocks={} blocks_meta={} commitment={}",
                !accounts.isEmpty(), !slots.isEmpty(), !transactions.isEmpty(),
                !transactionsStatus.isEmpty(), !entry.isEmpty(), !blocks.isEmpty(),
                !blocksMeta.isEmpty(), commitment);
        return request;
    }

    private AccountsFilter buildAccounts(FilterSpec spec) throws ConfigException {
        List<String> addresses = new ArrayList<>(orEmpty(spec.accountsAccount));
        if (spec.accountsAccountPath != null) {
            addresses.addAll(readAddressFile(Path.of(spec.accountsAccountPath)));
        }

        List<AccountsFilterRule> rules = new ArrayList<>();
        for (String memcmp : orEmpty(spec.accountsMemcmp)) {
            rules.add(parseMemcmp(memcmp));
        }
        if (spec.accountsDatasize != null) {
            rules.add(AccountsFilterRule.datasize(spec.accountsDatasize));
        }
        if (isSet(spec.accountsTokenAccountState)) {
            rules.add(AccountsFilterRule.tokenAccountState(true));
        }
        for (String lamports : orEmpty(spec.accountsLamports)) {
            rules.add(parseLamports(lamports));
        }

        return new AccountsFilter(addresses, orEmpty(spec.accountsOwner), rules,
                spec.accountsNonemptyTxnSignature);
    }

    List<String> readAddressFile(Path path) throws ConfigException {
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw ConfigException.io("cannot read account address file " + path, e);
        }
        try {
            List<String> addresses = mapper.readValue(json, STRING_LIST);
            log.info("subscription.accounts_file path={} addresses={}", path, addresses.size());
            return addresses;
        } catch (JsonProcessingException e) {
            throw ConfigException.parseSyntax("account address file " + path + " is not a JSON string array", e);
        }
    }

    static AccountsFilterRule parseMemcmp(String text) throws ConfigException {
        String[] parts = text.split(",", -1);
        if (parts.length != 2) {
            throw ConfigException.invalidFilter("memcmp", "expected offset,data but got '" + text + "'");
        }
        long offset = parseUnsigned(parts[0], "memcmp", text);
        String data = parts[1].trim();
        if (data.isEmpty()) {
            throw ConfigException.invalidFilter("memcmp", "missing data in '" + text + "'");
        }
        return AccountsFilterRule.memcmp(offset, data);
    }

    static AccountsFilterRule parseLamports(String text) throws ConfigException {
        String[] parts = text.split(":", -1);
        if (parts.length != 2) {
            throw ConfigException.invalidFilter("lamports", "expected cmp:value but got '" + text + "'");
        }
        LamportsComparator cmp = LamportsComparator.fromToken(parts[0]);
        if (cmp == null) {
            throw ConfigException.invalidFilter("lamports", "unknown comparator '" + parts[0] + "'");
        }
        return AccountsFilterRule.lamports(cmp, parseUnsigned(parts[1], "lamports", text));
    }

    static DataSlice parseDataSlice(String text) throws ConfigException {
        String[] parts = text.split(",", -1);
        if (parts.length != 2) {
            throw ConfigException.invalidFilter("data_slice", "expected offset,length but got '" + text + "'");
        }
        return new DataSlice(parseUnsigned(parts[0], "data_slice", text),
                             parseUnsigned(parts[1], "data_slice", text));
    }

    private static long parseUnsigned(String value, String category, String entry) throws ConfigException {
        try {
            return Long.parseUnsignedLong(value);
        } catch (NumberFormatException e) {
            throw ConfigException.invalidFilter(category, "'" + value + "' is not an unsigned integer in '" + entry + "'");
        }
    }

    private static boolean isSet(Boolean flag) {
        return Boolean.TRUE.equals(flag);
    }

    private static List<String> orEmpty(List<String> values) {
        return values == null ? List.of() : values;
    }
}
