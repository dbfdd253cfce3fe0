package com.driftindexer.ingestion.job;

import com.driftindexer.domain.IndexedEvent;
import com.driftindexer.domain.ProgramAddress;
import com.driftindexer.domain.event.OrderActionRecord;
import com.driftindexer.ingestion.adapter.FetchedTransaction;
import com.driftindexer.ingestion.adapter.SignatureInfo;
import com.driftindexer.ingestion.adapter.SourceUnavailableException;
import com.driftindexer.ingestion.adapter.TransactionSource;
import com.driftindexer.ingestion.config.IndexerProperties;
import com.driftindexer.ingestion.event.DriftEventFixtures;
import com.driftindexer.ingestion.event.EventRegistry;
import com.driftindexer.ingestion.event.OrderActionRecordDecoder;
import com.driftindexer.ingestion.event.OrderRecordDecoder;
import com.driftindexer.ingestion.log.LogScanner;
import com.driftindexer.ingestion.processor.TransactionProcessor;
import com.driftindexer.ingestion.store.InMemoryIndexerBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.driftindexer.ingestion.event.DriftEventFixtures.ACCOUNT;
import static com.driftindexer.ingestion.event.DriftEventFixtures.DRIFT_PROGRAM_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccountIndexerTest {

    private FakeTransactionSource source;
    private InMemoryIndexerBackend backend;
    private ExecutorService fetchExecutor;
    private AccountIndexer indexer;

    @BeforeEach
    void setUp() {
        source = new FakeTransactionSource();
        backend = new InMemoryIndexerBackend();
        fetchExecutor = Executors.newFixedThreadPool(4);
        LogScanner scanner = new LogScanner(new EventRegistry(List.of(new OrderActionRecordDecoder(), new OrderRecordDecoder())));
        TransactionProcessor processor = new TransactionProcessor(source, scanner, new ProgramAddress(DRIFT_PROGRAM_ID));
        IndexerProperties properties = new IndexerProperties();
        properties.setPageSize(3);
        indexer = new AccountIndexer(source, processor, backend, properties, fetchExecutor);
    }

    @AfterEach
    void tearDown() {
        fetchExecutor.shutdownNow();
    }

    @Test
    @DisplayName("one fill transaction: one OrderActionRecord stored and cursor set to its signature")
    void indexOnce_singleFill_storesEventAndCommitsCursor() {
        source.add("SIG1", List.of(ACCOUNT, DRIFT_PROGRAM_ID), DriftEventFixtures.FILL_TX_LOGS);

        indexer.indexOnce(ACCOUNT);

        assertThat(backend.events(OrderActionRecord.class)).containsExactly(DriftEventFixtures.fillRecord());
        assertThat(backend.events()).extracting(IndexedEvent::id).containsExactly("SIG1:2");
        assertThat(backend.getCursor(ACCOUNT)).contains("SIG1");
    }

    @Test
    @DisplayName("transaction without the program: no events but cursor still advances")
    void indexOnce_programAbsent_advancesCursorOnly() {
        source.add("SIG1", List.of(ACCOUNT), DriftEventFixtures.FILL_TX_LOGS);

        indexer.indexOnce(ACCOUNT);

        assertThat(backend.events()).isEmpty();
        assertThat(backend.getCursor(ACCOUNT)).contains("SIG1");
    }

    @Test
    @DisplayName("no new signatures: nothing written")
    void indexOnce_emptyPage_noop() {
        indexer.indexOnce(ACCOUNT);

        assertThat(backend.events()).isEmpty();
        assertThat(backend.getCursor(ACCOUNT)).isEmpty();
        assertThat(source.fetched).isEmpty();
    }

    @Test
    void indexOnce_fullPage_commitsNewestAndResumesFromIt() {
        source.add("SIG1", List.of(DRIFT_PROGRAM_ID), DriftEventFixtures.FILL_TX_LOGS);
        source.add("SIG2", List.of(DRIFT_PROGRAM_ID), DriftEventFixtures.FILL_TX_LOGS);
        source.add("SIG3", List.of(DRIFT_PROGRAM_ID), DriftEventFixtures.FILL_TX_LOGS);

        indexer.indexOnce(ACCOUNT);
        indexer.indexOnce(ACCOUNT);

        assertThat(backend.getCursor(ACCOUNT)).contains("SIG3");
        assertThat(backend.events()).extracting(IndexedEvent::signature).containsExactlyInAnyOrder("SIG1", "SIG2", "SIG3");
        assertThat(source.listings).containsExactly(new Listing(3, null), new Listing(3, "SIG3"));
    }

    @Test
    void indexOnce_pageSizeLimitsListing() {
        for (int i = 1; i <= 5; i++) {
            source.add("SIG" + i, List.of(DRIFT_PROGRAM_ID), List.of());
        }

        indexer.indexOnce(ACCOUNT);

        assertThat(source.fetched).containsExactlyInAnyOrder("SIG5", "SIG4", "SIG3");
        assertThat(backend.getCursor(ACCOUNT)).contains("SIG5");
    }

    @Test
    @DisplayName("a failed fetch aborts the pass without moving the cursor; the retry indexes each event once")
    void indexOnce_fetchFailure_keepsCursorAndRetryIsIdempotent() {
        source.add("SIG1", List.of(DRIFT_PROGRAM_ID), DriftEventFixtures.FILL_TX_LOGS);
        indexer.indexOnce(ACCOUNT);
        source.add("SIG2", List.of(DRIFT_PROGRAM_ID), DriftEventFixtures.FILL_TX_LOGS);
        source.add("SIG3", List.of(DRIFT_PROGRAM_ID), DriftEventFixtures.FILL_TX_LOGS);
        source.failing.add("SIG2");

        assertThatThrownBy(() -> indexer.indexOnce(ACCOUNT)).isInstanceOf(SourceUnavailableException.class);
        assertThat(backend.getCursor(ACCOUNT)).contains("SIG1");

        source.failing.clear();
        indexer.indexOnce(ACCOUNT);

        assertThat(backend.getCursor(ACCOUNT)).contains("SIG3");
        assertThat(backend.events()).extracting(IndexedEvent::id).containsExactlyInAnyOrder("SIG1:2", "SIG2:2", "SIG3:2");
    }

    @Test
    @DisplayName("a listed transaction the source cannot find aborts the pass and the cursor stays put")
    void indexOnce_listedTransactionNotFound_keepsCursor() {
        source.add("SIG1", List.of(DRIFT_PROGRAM_ID), DriftEventFixtures.FILL_TX_LOGS);
        source.add("SIG2", List.of(DRIFT_PROGRAM_ID), DriftEventFixtures.FILL_TX_LOGS);
        source.missing.add("SIG1");

        assertThatThrownBy(() -> indexer.indexOnce(ACCOUNT))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("SIG1");
        assertThat(backend.getCursor(ACCOUNT)).isEmpty();

        source.missing.clear();
        indexer.indexOnce(ACCOUNT);

        assertThat(backend.getCursor(ACCOUNT)).contains("SIG2");
        assertThat(backend.events()).extracting(IndexedEvent::id).containsExactlyInAnyOrder("SIG1:2", "SIG2:2");
    }

    @Test
    void indexOnce_fetchFailure_waitsForRemainingFetchesBeforeThrowing() {
        source.add("SIG1", List.of(DRIFT_PROGRAM_ID), DriftEventFixtures.FILL_TX_LOGS);
        source.add("SIG2", List.of(DRIFT_PROGRAM_ID), DriftEventFixtures.FILL_TX_LOGS);
        source.add("SIG3", List.of(DRIFT_PROGRAM_ID), DriftEventFixtures.FILL_TX_LOGS);
        source.failing.add("SIG3");
        source.delaysMs.put("SIG1", 300L);
        source.delaysMs.put("SIG2", 300L);

        assertThatThrownBy(() -> indexer.indexOnce(ACCOUNT)).isInstanceOf(SourceUnavailableException.class);

        assertThat(source.completed).containsExactlyInAnyOrder("SIG1", "SIG2");
        assertThat(backend.getCursor(ACCOUNT)).isEmpty();
    }

    @Test
    void indexOnce_failedTransactionListed_stillScannedAndCommitted() {
        source.add("SIG1", List.of(DRIFT_PROGRAM_ID), DriftEventFixtures.FILL_TX_LOGS);
        source.add("SIG2", List.of(DRIFT_PROGRAM_ID), List.of("Program log: Error: insufficient collateral"));
        source.executedWithError.add("SIG2");

        indexer.indexOnce(ACCOUNT);

        assertThat(source.fetched).containsExactlyInAnyOrder("SIG1", "SIG2");
        assertThat(backend.events()).extracting(IndexedEvent::id).containsExactly("SIG1:2");
        assertThat(backend.getCursor(ACCOUNT)).contains("SIG2");
    }

    @Test
    void indexOnce_reprocessedPage_doesNotDuplicateEvents() {
        source.add("SIG1", List.of(DRIFT_PROGRAM_ID), DriftEventFixtures.FILL_TX_LOGS);

        indexer.indexOnce(ACCOUNT);
        backend.setCursor(ACCOUNT, "SIG0");
        indexer.indexOnce(ACCOUNT);

        assertThat(backend.insertCalls()).isEqualTo(2);
        assertThat(backend.events()).hasSize(1);
    }

    @Test
    void indexOnce_listingFailure_propagates() {
        source.listingFails = true;

        assertThatThrownBy(() -> indexer.indexOnce(ACCOUNT)).isInstanceOf(SourceUnavailableException.class);
        assertThat(backend.getCursor(ACCOUNT)).isEmpty();
    }

    record Listing(int limit, String until) {
    }

    /**
     * Account history held newest first. Signatures in {@link #failing} fail to fetch, those in
     * {@link #missing} are reported as not found.
     */
    static class FakeTransactionSource implements TransactionSource {
        private final List<String> history = Collections.synchronizedList(new ArrayList<>());
        private final Map<String, FetchedTransaction> transactions = new ConcurrentHashMap<>();
        final Set<String> failing = ConcurrentHashMap.newKeySet();
        final Set<String> missing = ConcurrentHashMap.newKeySet();
        final Set<String> executedWithError = ConcurrentHashMap.newKeySet();
        final Map<String, Long> delaysMs = new ConcurrentHashMap<>();
        final List<String> completed = Collections.synchronizedList(new ArrayList<>());
        final List<String> fetched = Collections.synchronizedList(new ArrayList<>());
        final List<Listing> listings = Collections.synchronizedList(new ArrayList<>());
        volatile boolean listingFails;

        void add(String signature, List<String> accountKeys, List<String> logs) {
            history.add(0, signature);
            transactions.put(signature, new FetchedTransaction(signature, history.size(), accountKeys, logs));
        }

        @Override
        public List<SignatureInfo> listSignatures(String account, int limit, String untilSignature) {
            listings.add(new Listing(limit, untilSignature));
            if (listingFails) {
                throw new SourceUnavailableException("listing unavailable");
            }
            List<SignatureInfo> page = new ArrayList<>();
            for (String signature : history) {
                if (signature.equals(untilSignature) || page.size() == limit) {
                    break;
                }
                page.add(new SignatureInfo(signature, transactions.get(signature).slot(),
                        executedWithError.contains(signature), 1685504150L + page.size()));
            }
            return page;
        }

        @Override
        public Optional<FetchedTransaction> getTransaction(String signature) {
            fetched.add(signature);
            Long delay = delaysMs.get(signature);
            if (delay != null) {
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SourceUnavailableException("fetch of " + signature + " interrupted", e);
                }
            }
            if (failing.contains(signature)) {
                throw new SourceUnavailableException("fetch of " + signature + " failed");
            }
            completed.add(signature);
            if (missing.contains(signature)) {
                return Optional.empty();
            }
            return Optional.ofNullable(transactions.get(signature));
        }
    }
}
