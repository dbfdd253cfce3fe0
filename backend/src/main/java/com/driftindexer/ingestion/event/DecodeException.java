package com.driftindexer.ingestion.event;

import com.driftindexer.common.IndexerException;

/**
 * A payload carried a known discriminant but its bytes do not match the event's Borsh layout.
 */
public class DecodeException extends IndexerException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
