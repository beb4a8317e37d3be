package com.rebalanceradar.ingestion.job.backfill;

import com.rebalanceradar.domain.SupportedChain;

/**
 * Outcome of one scan. {@code lastIndexedBlock} is the end of the last fully enqueued batch, or
 * {@code fromBlock - 1} when no batch completed.
 */
public record BackfillResult(
        SupportedChain chain,
        long fromBlock,
        long toBlock,
        long lastIndexedBlock,
        long eventsProcessed,
        long blocksScanned,
        Status status
) {

    public enum Status {
        COMPLETED,
        PAUSED,
        /** Lease expired and was taken by another scanner; progress after that point belongs to it. */
        LEASE_LOST
    }
}
