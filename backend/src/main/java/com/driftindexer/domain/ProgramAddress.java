package com.driftindexer.domain;

import java.util.Collection;

/**
 * Address of the on-chain program whose events are indexed. Built once at startup from configuration
 * and injected wherever transactions are filtered.
 */
public record ProgramAddress(String base58) {

    public boolean isReferencedBy(Collection<String> accountKeys) {
        return accountKeys != null && accountKeys.contains(base58);
    }

    @Override
    public String toString() {
        return base58;
    }
}
