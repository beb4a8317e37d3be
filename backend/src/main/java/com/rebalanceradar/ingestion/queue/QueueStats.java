package com.rebalanceradar.ingestion.queue;

/**
 * Item counts per queue status plus dead letters.
 */
public record QueueStats(long pending, long processing, long done, long deadLettered) {
}
