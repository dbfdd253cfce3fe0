package com.driftindexer.ingestion.log;

import com.driftindexer.common.IndexerException;

/**
 * A log line carried a payload marker but the text after it is not a valid base64 event envelope.
 */
public class LogParseException extends IndexerException {

    public LogParseException(String message) {
        super(message);
    }

    public LogParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
