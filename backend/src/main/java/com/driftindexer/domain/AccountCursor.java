package com.driftindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Resume cursor per monitored account: the newest signature whose page was fully indexed.
 * Keyed by the base58 account address, so the upsert is a single-document write.
 */
@Document(collection = "accounts")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AccountCursor {

    @Id
    @EqualsAndHashCode.Include
    private String address;
    private String lastProcessedSignature;
    private Instant updatedAt;

    public AccountCursor(String address, String lastProcessedSignature, Instant updatedAt) {
        this.address = address;
        this.lastProcessedSignature = lastProcessedSignature;
        this.updatedAt = updatedAt;
    }
}
