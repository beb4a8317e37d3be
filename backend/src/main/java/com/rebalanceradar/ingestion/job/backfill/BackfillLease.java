package com.rebalanceradar.ingestion.job.backfill;

import com.rebalanceradar.domain.SupportedChain;

/**
 * Exclusive right to scan one chain, held from acquisition until the scan's finally block.
 *
 * @param latestIndexedBlock progress recorded when the lease was taken; null if nothing was indexed yet
 */
public record BackfillLease(SupportedChain chain, String owner, Long latestIndexedBlock) {
}
