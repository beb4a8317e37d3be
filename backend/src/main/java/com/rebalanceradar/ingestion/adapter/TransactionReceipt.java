package com.rebalanceradar.ingestion.adapter;

import java.math.BigInteger;

/**
 * The receipt fields the indexer reads: who sent the transaction and what it cost.
 */
public record TransactionReceipt(
        String transactionHash,
        String from,
        BigInteger gasUsed,
        BigInteger effectiveGasPrice,
        boolean success
) {
}
