package com.rebalanceradar.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Backfill lease and cursor updates. Lease operations are conditional on the owner so a scanner
 * whose lease expired and was taken over can no longer move progress.
 */
public interface ChainIndexStateRepositoryCustom {

    /**
     * Takes the backfill lease if it is free or expired; clears any pending pause request.
     *
     * @return the state after acquisition, or empty if another owner holds a live lease
     */
    Optional<ChainIndexState> tryAcquireBackfillLease(long chainId, String owner, Instant now, Instant leaseUntil);

    void recordBackfillTarget(long chainId, String owner, long targetBlock);

    /**
     * Advances latestIndexedBlock (never backwards) and renews the lease.
     *
     * @return the state after the update, or empty if the lease is no longer held by owner
     */
    Optional<ChainIndexState> recordBackfillBatch(long chainId, String owner, long lastBlock, Instant leaseUntil);

    void releaseBackfillLease(long chainId, String owner, String lastError);

    /** Flags every chain with a running backfill to stop before its next batch. Returns chains flagged. */
    long requestPauseAll();

    boolean requestPause(long chainId);

    void recordLiveBlock(long chainId, long block);
}
