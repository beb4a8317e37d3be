package com.rebalanceradar.ingestion.adapter;

import java.time.Instant;
import java.util.List;

/**
 * Raw contract log. blockTimestamp is set only when the RPC includes it in the log object.
 */
public record ChainLog(
        String address,
        List<String> topics,
        String data,
        long blockNumber,
        String transactionHash,
        long logIndex,
        Instant blockTimestamp
) {
}
