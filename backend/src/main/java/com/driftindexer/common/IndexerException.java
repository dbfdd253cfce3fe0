package com.driftindexer.common;

/**
 * Root of the indexer's unchecked exception hierarchy.
 */
public class IndexerException extends RuntimeException {

    public IndexerException(String message) {
        super(message);
    }

    public IndexerException(String message, Throwable cause) {
        super(message, cause);
    }
}
