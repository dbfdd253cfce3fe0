package com.driftindexer.ingestion.processor;

import com.driftindexer.domain.event.DriftEvent;

/**
 * An event found in a transaction's logs; {@code logIndex} is the position of its line in the log messages.
 */
public record ExtractedEvent(int logIndex, DriftEvent event) {
}
