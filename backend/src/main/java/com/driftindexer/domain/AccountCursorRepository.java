package com.driftindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for the accounts collection (one cursor per monitored account).
 */
public interface AccountCursorRepository extends MongoRepository<AccountCursor, String> {
}
