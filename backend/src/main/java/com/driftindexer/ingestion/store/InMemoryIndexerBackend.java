package com.driftindexer.ingestion.store;

import com.driftindexer.domain.IndexedEvent;
import com.driftindexer.domain.event.DriftEvent;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local backend for dry runs ({@code driftindexer.store.type=memory}) and tests. Nothing survives a restart.
 */
@Component
@ConditionalOnProperty(name = "driftindexer.store.type", havingValue = "memory")
public class InMemoryIndexerBackend implements IndexerBackend {

    private final Map<String, String> cursors = new ConcurrentHashMap<>();
    private final Map<String, IndexedEvent> events = new LinkedHashMap<>();
    private final AtomicInteger insertCalls = new AtomicInteger();

    @Override
    public Optional<String> getCursor(String account) {
        return Optional.ofNullable(cursors.get(account));
    }

    @Override
    public void setCursor(String account, String signature) {
        cursors.put(account, signature);
    }

    @Override
    public void insertEvent(IndexedEvent event) {
        insertCalls.incrementAndGet();
        synchronized (events) {
            events.put(event.id(), event);
        }
    }

    /** Stored events in first-insertion order. */
    public List<IndexedEvent> events() {
        synchronized (events) {
            return new ArrayList<>(events.values());
        }
    }

    public <T extends DriftEvent> List<T> events(Class<T> type) {
        return events().stream()
                .map(IndexedEvent::event)
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    /** Number of insertEvent calls, duplicates included. */
    public int insertCalls() {
        return insertCalls.get();
    }
}
