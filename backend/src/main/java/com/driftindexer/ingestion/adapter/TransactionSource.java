package com.driftindexer.ingestion.adapter;

import java.util.List;
import java.util.Optional;

/**
 * Read access to an account's transaction history.
 */
public interface TransactionSource {

    /**
     * Signatures of transactions touching {@code account}, newest first, at most {@code limit}, stopping before
     * {@code untilSignature} when it is given.
     *
     * @throws SourceUnavailableException on transport or RPC failure
     */
    List<SignatureInfo> listSignatures(String account, int limit, String untilSignature);

    /**
     * @return the transaction, or empty if the source does not know the signature
     * @throws SourceUnavailableException                on transport or RPC failure
     * @throws UnsupportedTransactionEncodingException if the body cannot be parsed into a message
     */
    Optional<FetchedTransaction> getTransaction(String signature);
}
