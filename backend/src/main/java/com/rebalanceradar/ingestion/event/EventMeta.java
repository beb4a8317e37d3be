package com.rebalanceradar.ingestion.event;

import java.time.Instant;

/**
 * Where a log came from. {@link #position()} orders events within a chain.
 */
public record EventMeta(long chainId, String txHash, long blockNumber, long logIndex, Instant blockTimestamp) {

    static final long LOG_INDEX_SPAN = 1_000_000L;

    public long position() {
        return blockNumber * LOG_INDEX_SPAN + logIndex;
    }

    /** {chainId}-{txHash}-{logIndex}; id of rebalances, swaps and system events. */
    public String recordKey() {
        return chainId + "-" + txHash + "-" + logIndex;
    }
}
