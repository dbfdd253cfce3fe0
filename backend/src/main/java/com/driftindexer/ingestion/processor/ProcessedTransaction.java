package com.driftindexer.ingestion.processor;

import com.driftindexer.domain.IndexedEvent;

import java.util.List;

/**
 * Result of processing one signature. {@code events} is empty for transactions that were not found,
 * could not be decoded or do not reference the program.
 */
public record ProcessedTransaction(String signature, long slot, List<ExtractedEvent> events) {

    public ProcessedTransaction {
        events = events == null ? List.of() : List.copyOf(events);
    }

    static ProcessedTransaction empty(String signature) {
        return new ProcessedTransaction(signature, 0L, List.of());
    }

    public List<IndexedEvent> toIndexedEvents(String account) {
        return events.stream()
                .map(e -> new IndexedEvent(signature, e.logIndex(), account, slot, e.event()))
                .toList();
    }
}
