package com.rebalanceradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Head polling for new logs and gas price.
 */
@ConfigurationProperties(prefix = "rebalanceradar.ingestion.live")
@NoArgsConstructor
@Getter
@Setter
public class LiveSubscriberProperties {

    private boolean enabled = true;

    /** Poll interval in ms (fixedDelay). Default 3s. */
    private long pollIntervalMs = 3_000;

    /** Blocks to stay behind the head. 0 follows the head directly; replays are absorbed downstream. */
    private int confirmations = 0;

    /** Publish gas price changes on the gas channel. */
    private boolean publishGasPrice = true;
}
