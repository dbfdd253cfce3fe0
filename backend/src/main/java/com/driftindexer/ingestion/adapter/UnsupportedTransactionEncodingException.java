package com.driftindexer.ingestion.adapter;

import com.driftindexer.common.IndexerException;

/**
 * A fetched transaction body could not be parsed into a message. Callers treat the transaction as a no-op.
 */
public class UnsupportedTransactionEncodingException extends IndexerException {

    public UnsupportedTransactionEncodingException(String message) {
        super(message);
    }

    public UnsupportedTransactionEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
