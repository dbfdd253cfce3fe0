package com.driftindexer.ingestion.job;

import com.driftindexer.common.IndexerException;
import com.driftindexer.config.AsyncConfig;
import com.driftindexer.domain.IndexedEvent;
import com.driftindexer.ingestion.adapter.SignatureInfo;
import com.driftindexer.ingestion.adapter.TransactionSource;
import com.driftindexer.ingestion.config.IndexerProperties;
import com.driftindexer.ingestion.processor.ProcessedTransaction;
import com.driftindexer.ingestion.processor.TransactionProcessor;
import com.driftindexer.ingestion.store.IndexerBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;

/**
 * One indexing pass over an account: list the signatures newer than the cursor, process them concurrently,
 * persist events as each transaction completes, then commit the newest signature of the page as the cursor.
 * <p>
 * The cursor only moves once every signature of the page has been processed and persisted. A failed pass
 * leaves the cursor where it was, so the next pass sees the same page again; events already written are
 * replaced in place on that retry. A failed pass still waits for the rest of the page's fetches before it throws.
 */
@Component
@Slf4j
public class AccountIndexer {

    private final TransactionSource transactionSource;
    private final TransactionProcessor transactionProcessor;
    private final IndexerBackend indexerBackend;
    private final IndexerProperties indexerProperties;
    private final Executor fetchExecutor;

    public AccountIndexer(TransactionSource transactionSource,
                          TransactionProcessor transactionProcessor,
                          IndexerBackend indexerBackend,
                          IndexerProperties indexerProperties,
                          @Qualifier(AsyncConfig.FETCH_EXECUTOR) Executor fetchExecutor) {
        this.transactionSource = transactionSource;
        this.transactionProcessor = transactionProcessor;
        this.indexerBackend = indexerBackend;
        this.indexerProperties = indexerProperties;
        this.fetchExecutor = fetchExecutor;
    }

    /**
     * @throws com.driftindexer.ingestion.adapter.SourceUnavailableException if listing or a fetch fails
     * @throws com.driftindexer.ingestion.store.StorageException             if the cursor or an event cannot be stored
     */
    public void indexOnce(String account) {
        Optional<String> cursor = indexerBackend.getCursor(account);
        log.debug("Indexing {} from cursor {}", account, cursor.orElse("<none>"));

        List<SignatureInfo> page = transactionSource.listSignatures(account, indexerProperties.getPageSize(), cursor.orElse(null));
        if (page.isEmpty()) {
            log.debug("No new signatures for {}", account);
            return;
        }
        log.info("Found {} new signature(s) for {}", page.size(), account);

        CompletionService<ProcessedTransaction> completionService = new ExecutorCompletionService<>(fetchExecutor);
        List<Future<ProcessedTransaction>> futures = new ArrayList<>(page.size());
        for (SignatureInfo info : page) {
            futures.add(completionService.submit(() -> transactionProcessor.process(account, info.signature())));
        }

        RuntimeException failure = null;
        int indexed = 0;
        // all fetches of the page are awaited, also after a failure
        for (int i = 0; i < futures.size(); i++) {
            Future<ProcessedTransaction> done;
            try {
                done = completionService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IndexerException("Interrupted while indexing " + account, e);
            }
            try {
                ProcessedTransaction processed = done.get();
                if (failure == null) {
                    indexed += persist(account, processed);
                }
            } catch (ExecutionException e) {
                if (failure == null) {
                    failure = unwrap(e);
                } else {
                    log.debug("Further failure in pass for {}: {}", account, e.getCause().getMessage());
                }
            } catch (InterruptedException e) {
                // take() returned a completed future, get() does not block
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                }
            }
        }
        if (failure != null) {
            log.warn("Indexing pass for {} failed, cursor stays at {}: {}", account, cursor.orElse("<none>"), failure.getMessage());
            throw failure;
        }

        SignatureInfo newest = page.get(0);
        indexerBackend.setCursor(account, newest.signature());
        long failedTxs = page.stream().filter(SignatureInfo::failed).count();
        if (failedTxs > 0) {
            log.debug("{} of {} transaction(s) for {} executed with an error", failedTxs, page.size(), account);
        }
        log.info("Indexed {} event(s) from {} transaction(s) for {}, cursor now {} (slot {}, blockTime {})",
                indexed, page.size(), account, newest.signature(), newest.slot(), newest.blockTime());
    }

    private int persist(String account, ProcessedTransaction processed) {
        List<IndexedEvent> events = processed.toIndexedEvents(account);
        for (IndexedEvent event : events) {
            indexerBackend.insertEvent(event);
            log.debug("Stored {} {} for {}", event.event().kind().getEventName(), event.id(), account);
        }
        return events.size();
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IndexerException("Transaction processing failed", cause);
    }
}
