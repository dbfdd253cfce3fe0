package com.driftindexer.ingestion.adapter;

import com.driftindexer.common.IndexerException;

/**
 * The transaction source could not be reached or answered with an error (HTTP or JSON-RPC), after retries.
 * Aborts the current tick; the next tick retries from the committed cursor.
 */
public class SourceUnavailableException extends IndexerException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
