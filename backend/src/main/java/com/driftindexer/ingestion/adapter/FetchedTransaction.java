package com.driftindexer.ingestion.adapter;

import java.util.List;

/**
 * Transaction body as needed by the indexer: static account keys of the message (base58) and the
 * log messages from its status meta. Lives only for one processing call.
 */
public record FetchedTransaction(String signature, long slot, List<String> accountKeys, List<String> logMessages) {

    public FetchedTransaction {
        accountKeys = accountKeys == null ? List.of() : List.copyOf(accountKeys);
        logMessages = logMessages == null ? List.of() : List.copyOf(logMessages);
    }
}
