package com.rebalanceradar.ingestion.event;

import java.time.Instant;
import java.util.Map;

/**
 * Decoded contract log as produced by both the backfill scanner and the live subscriber.
 * {@code data} maps ABI argument names to strings, booleans or lists of strings; integers are decimal strings.
 */
public record RawChainEvent(
        long chainId,
        String eventName,
        long blockNumber,
        Instant blockTimestamp,
        String transactionHash,
        long logIndex,
        Map<String, Object> data
) {

    public RawChainEvent {
        transactionHash = transactionHash == null ? null : transactionHash.toLowerCase();
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    /** Queue and record identity: {chainId}-{txHash}-{logIndex}. */
    public String eventKey() {
        return chainId + "-" + transactionHash + "-" + logIndex;
    }

    public RawChainEvent withData(Map<String, Object> newData) {
        return new RawChainEvent(chainId, eventName, blockNumber, blockTimestamp, transactionHash, logIndex, newData);
    }
}
