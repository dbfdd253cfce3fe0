package com.driftindexer.ingestion.store;

import com.driftindexer.config.CaffeineConfig;
import com.driftindexer.domain.AccountCursor;
import com.driftindexer.domain.AccountCursorRepository;
import com.driftindexer.domain.IndexedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * MongoDB backend. Cursors live in {@code accounts} keyed by address; events go to one collection per kind,
 * keyed by {@code signature:logIndex} so a reprocessed signature replaces rather than duplicates its events.
 */
@Component
@ConditionalOnProperty(name = "driftindexer.store.type", havingValue = "mongo", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MongoIndexerBackend implements IndexerBackend {

    private final MongoTemplate mongoTemplate;
    private final AccountCursorRepository cursorRepository;
    private final CacheManager cacheManager;

    @Override
    @Cacheable(cacheNames = CaffeineConfig.CURSOR_CACHE, key = "#account")
    public Optional<String> getCursor(String account) {
        try {
            return cursorRepository.findById(account).map(AccountCursor::getLastProcessedSignature);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read cursor for " + account, e);
        }
    }

    @Override
    public void setCursor(String account, String signature) {
        try {
            mongoTemplate.upsert(
                    Query.query(Criteria.where("_id").is(account)),
                    new Update().set("lastProcessedSignature", signature).set("updatedAt", Instant.now()),
                    AccountCursor.class);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to set cursor for " + account + " to " + signature, e);
        }
        Cache cache = cacheManager.getCache(CaffeineConfig.CURSOR_CACHE);
        if (cache != null) {
            cache.put(account, signature);
        }
        log.debug("Cursor for {} set to {}", account, signature);
    }

    @Override
    public void insertEvent(IndexedEvent indexed) {
        String collection = indexed.event().kind().getCollection();
        try {
            Document doc = new Document();
            mongoTemplate.getConverter().write(indexed.event(), doc);
            doc.put("_id", indexed.id());
            doc.put("signature", indexed.signature());
            doc.put("logIndex", indexed.logIndex());
            doc.put("account", indexed.account());
            doc.put("slot", indexed.slot());
            doc.put("indexedAt", Instant.now());
            mongoTemplate.save(doc, collection);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to insert " + indexed.event().kind() + " " + indexed.id(), e);
        }
    }
}
