package com.rebalanceradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Historical scan settings.
 */
@ConfigurationProperties(prefix = "rebalanceradar.ingestion.backfill")
@NoArgsConstructor
@Getter
@Setter
public class BackfillProperties {

    /** Blocks per eth_getLogs batch unless the chain overrides it. */
    private int batchBlockSize = 1000;

    /** Pause between batches to stay under provider rate limits. */
    private long interBatchDelayMs = 100;

    /**
     * Lease lifetime; renewed after every batch. A crashed scanner blocks its chain at most this long.
     */
    private long leaseTtlMs = 300_000;

    /** Resume chains with auto-resume=true once the application is ready. */
    private boolean autoResumeOnStartup = true;
}
