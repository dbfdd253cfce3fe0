package com.driftindexer.domain;

import com.driftindexer.domain.event.DriftEvent;

/**
 * A decoded event with its provenance. {@link #id()} is stable across reprocessing of the same
 * signature, which is what makes event insertion duplicate-tolerant.
 *
 * @param signature transaction the event was logged in
 * @param logIndex  position of the log line within the transaction's log messages
 * @param account   monitored account whose history surfaced the transaction
 * @param slot      slot of the transaction
 * @param event     decoded payload
 */
public record IndexedEvent(String signature, int logIndex, String account, long slot, DriftEvent event) {

    public String id() {
        return signature + ":" + logIndex;
    }
}
