package com.driftindexer.ingestion.store;

import com.driftindexer.domain.IndexedEvent;

import java.util.Optional;

/**
 * Persistence needed by the indexer. Implementations must be safe for concurrent use by all pollers and by the
 * concurrent fetches of one tick.
 */
public interface IndexerBackend {

    /**
     * @return last fully indexed signature for {@code account}, empty if the account was never indexed
     * @throws StorageException on read failure
     */
    Optional<String> getCursor(String account);

    /**
     * Create or replace the cursor of {@code account}.
     *
     * @throws StorageException on write failure
     */
    void setCursor(String account, String signature);

    /**
     * Store one event. Inserting an event with the same {@link IndexedEvent#id()} again is not an error
     * and leaves a single record.
     *
     * @throws StorageException on write failure
     */
    void insertEvent(IndexedEvent event);
}
