package com.driftindexer.ingestion.adapter;

/**
 * One entry of a signature listing.
 *
 * @param failed    the transaction executed with an error (it is still examined; failed txs log no events)
 * @param blockTime unix seconds, {@code null} when the node does not know it
 */
public record SignatureInfo(String signature, long slot, boolean failed, Long blockTime) {
}
