package com.driftindexer.common;

/**
 * Bad startup configuration (account id, program id, connection settings). Fatal: the process exits non-zero.
 */
public class InvalidConfigurationException extends IndexerException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
