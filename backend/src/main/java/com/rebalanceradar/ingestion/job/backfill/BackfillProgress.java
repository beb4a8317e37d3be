package com.rebalanceradar.ingestion.job.backfill;

/**
 * @param currentBlock       chain head, or the last known scan target when the head cannot be read
 * @param latestIndexedBlock null until the first batch of the chain completes
 */
public record BackfillProgress(boolean isBackfilling, Long currentBlock, Long latestIndexedBlock, long remainingBlocks) {
}
