package com.driftindexer.ingestion.processor;

import com.driftindexer.domain.ProgramAddress;
import com.driftindexer.domain.event.DriftEvent;
import com.driftindexer.ingestion.adapter.FetchedTransaction;
import com.driftindexer.ingestion.adapter.SourceUnavailableException;
import com.driftindexer.ingestion.adapter.TransactionSource;
import com.driftindexer.ingestion.adapter.UnsupportedTransactionEncodingException;
import com.driftindexer.ingestion.event.DecodeException;
import com.driftindexer.ingestion.log.LogParseException;
import com.driftindexer.ingestion.log.LogScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns one signature into the program events its logs carry. Performs a single source fetch and no storage I/O,
 * so it can run concurrently for every signature of a page.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TransactionProcessor {

    private final TransactionSource transactionSource;
    private final LogScanner logScanner;
    private final ProgramAddress programAddress;

    /**
     * @param account monitored account, for logging
     * @throws SourceUnavailableException if the fetch fails after retries, or the listed transaction is not found
     */
    public ProcessedTransaction process(String account, String signature) {
        Optional<FetchedTransaction> fetched;
        try {
            fetched = transactionSource.getTransaction(signature);
        } catch (UnsupportedTransactionEncodingException e) {
            log.warn("Skipping {} for {}: {}", signature, account, e.getMessage());
            return ProcessedTransaction.empty(signature);
        }
        if (fetched.isEmpty()) {
            throw new SourceUnavailableException("Transaction " + signature + " listed for " + account + " was not found");
        }
        FetchedTransaction tx = fetched.get();
        if (!programAddress.isReferencedBy(tx.accountKeys())) {
            log.debug("Transaction {} does not reference {}", signature, programAddress);
            return new ProcessedTransaction(signature, tx.slot(), List.of());
        }

        List<ExtractedEvent> events = new ArrayList<>();
        List<String> logs = tx.logMessages();
        for (int i = 0; i < logs.size(); i++) {
            try {
                Optional<DriftEvent> event = logScanner.extract(logs.get(i));
                if (event.isPresent()) {
                    events.add(new ExtractedEvent(i, event.get()));
                }
            } catch (LogParseException | DecodeException e) {
                log.debug("Skipping log line {} of {}: {}", i, signature, e.getMessage());
            }
        }
        if (!events.isEmpty()) {
            log.debug("Transaction {} carries {} event(s)", signature, events.size());
        }
        return new ProcessedTransaction(signature, tx.slot(), events);
    }
}
