package com.driftindexer.ingestion.store;

import com.driftindexer.common.IndexerException;

/**
 * A cursor or event write/read failed. Aborts the tick without advancing the cursor.
 */
public class StorageException extends IndexerException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
