package com.rebalanceradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * EVM RPC throttling and endpoint cool-down settings for ingestion.
 */
@ConfigurationProperties(prefix = "rebalanceradar.ingestion.evm-rpc")
@NoArgsConstructor
@Getter
@Setter
public class IngestionEvmRpcProperties {

    /** Global EVM RPC budget (requests per second) for this service instance. Public testnet RPCs are strict. */
    private int maxRequestsPerSecond = 25;

    /** Time to skip an endpoint after rate-limit errors (HTTP 429). */
    private long endpointCooldownMs = 60_000;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 100;

    /** How long local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 5_000;
}
