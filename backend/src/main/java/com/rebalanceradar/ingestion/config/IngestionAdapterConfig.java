package com.rebalanceradar.ingestion.config;

import com.rebalanceradar.common.RetryPolicy;
import com.rebalanceradar.ingestion.adapter.RpcEndpointRotator;
import com.rebalanceradar.ingestion.adapter.evm.EvmRpcClient;
import com.rebalanceradar.ingestion.adapter.evm.WebClientEvmRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Configures RPC access from per-chain config: one rotator per configured chain, a shared local rate limiter.
 */
@Configuration
@EnableConfigurationProperties({ IngestionChainProperties.class, IngestionRetryProperties.class,
        IngestionEvmRpcProperties.class, BackfillProperties.class, IngestionQueueProperties.class,
        LiveSubscriberProperties.class })
public class IngestionAdapterConfig {

    @Autowired
    private IngestionRetryProperties retryProperties;

    private RetryPolicy retryPolicy() {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getMaxDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    /** Key = SupportedChain name. Chains without urls get no rotator. */
    @Bean
    public Map<String, RpcEndpointRotator> evmRotatorsByChain(IngestionChainProperties properties) {
        return properties.getChains().entrySet().stream()
                .filter(e -> e.getValue() != null && !e.getValue().getUrls().isEmpty())
                .collect(Collectors.toMap(Map.Entry::getKey, e -> new RpcEndpointRotator(e.getValue().getUrls(), retryPolicy())));
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(IngestionEvmRpcProperties evmRpcProperties) {
        int rps = Math.max(1, evmRpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, evmRpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }
}
