package com.rebalanceradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Durable ingestion queue: partitioning, redelivery backoff and dead-lettering.
 */
@ConfigurationProperties(prefix = "rebalanceradar.ingestion.queue")
@NoArgsConstructor
@Getter
@Setter
public class IngestionQueueProperties {

    /**
     * Number of partitions, one consumer loop each. Events of one user always land in the same partition.
     */
    private int partitions = 4;

    /** Deliveries before an item is dead-lettered. */
    private int maxAttempts = 3;

    /** First redelivery delay; doubles per attempt. */
    private long baseDelayMs = 2_000;

    /** Redelivery delay ceiling. */
    private long maxDelayMs = 60_000;

    private double jitterFactor = 0.2;

    /** Consumer sleep when its partition has nothing ready. */
    private long pollIntervalMs = 500;

    /** A PROCESSING claim older than this is considered abandoned and is released. */
    private long staleAfterMs = 300_000;

    /** How often (ms) abandoned claims are swept. */
    private long staleRecoveryIntervalMs = 60_000;

    /** Start consumer loops on startup. */
    private boolean consumersEnabled = true;
}
