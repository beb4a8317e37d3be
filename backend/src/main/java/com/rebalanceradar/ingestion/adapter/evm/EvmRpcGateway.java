package com.rebalanceradar.ingestion.adapter.evm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebalanceradar.domain.SupportedChain;
import com.rebalanceradar.ingestion.adapter.RpcEndpointRotator;
import com.rebalanceradar.ingestion.adapter.RpcException;
import com.rebalanceradar.ingestion.config.IngestionEvmRpcProperties;
import com.rebalanceradar.ingestion.config.UnknownChainException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One JSON-RPC call against a chain: rotates endpoints, waits on the local rate limiter, backs off
 * between attempts and skips endpoints cooling down after a rate-limit response.
 * Returns the {@code result} node; a JSON-RPC {@code error} becomes an {@link RpcException}.
 */
@Slf4j
@Component
public class EvmRpcGateway {

    private final Map<String, Long> endpointCooldownUntilMs = new ConcurrentHashMap<>();

    private final EvmRpcClient rpcClient;
    private final Map<String, RpcEndpointRotator> rotatorsByChain;
    private final RateLimiter evmRpcRateLimiter;
    private final IngestionEvmRpcProperties evmRpcProperties;
    private final ObjectMapper objectMapper;

    public EvmRpcGateway(
            EvmRpcClient rpcClient,
            @Qualifier("evmRotatorsByChain") Map<String, RpcEndpointRotator> rotatorsByChain,
            @Qualifier("evmRpcRateLimiter") RateLimiter evmRpcRateLimiter,
            IngestionEvmRpcProperties evmRpcProperties,
            ObjectMapper objectMapper
    ) {
        this.rpcClient = rpcClient;
        this.rotatorsByChain = rotatorsByChain;
        this.evmRpcRateLimiter = evmRpcRateLimiter;
        this.evmRpcProperties = evmRpcProperties;
        this.objectMapper = objectMapper;
    }

    public JsonNode call(SupportedChain chain, String method, Object params) {
        RpcEndpointRotator rotator = rotatorsByChain.get(chain.name());
        if (rotator == null) {
            throw new UnknownChainException("No RPC endpoints configured for " + chain);
        }
        RuntimeException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = nextEndpoint(rotator);
            try {
                return callOnce(endpoint, method, params);
            } catch (RuntimeException e) {
                lastException = e;
                if (isRangeTooWideError(e)) {
                    throw e instanceof RpcException rpc ? rpc : new RpcException(messageOf(e), e);
                }
                if (isRateLimited(e)) {
                    markEndpointCoolingDown(endpoint, e);
                }
                log.debug("{} attempt {} on {} failed: {}", method, attempt + 1, endpoint, messageOf(e));
            }
        }
        throw new RpcException(method + " failed on " + chain + " after " + rotator.getMaxAttempts()
                + " attempts: " + messageOf(lastException), lastException);
    }

    private JsonNode callOnce(String endpoint, String method, Object params) {
        long acquireStart = System.nanoTime();
        boolean permitted = evmRpcRateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, evmRpcProperties.getLocalLimiterLogThresholdMs())) {
            log.info("Local EVM RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpoint);
        }
        String json = rpcClient.call(endpoint, method, params).block();
        if (json == null) {
            throw new RpcException(method + " returned empty body from " + endpoint);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        return root.path("result");
    }

    public static boolean isRangeTooWideError(Exception e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase();
        return msg.contains("-32701") || msg.contains("-32602") && msg.contains("range")
                || msg.contains("query returned more than") || msg.contains("too many results")
                || msg.contains("block range is too wide") || msg.contains("exceed maximum block range")
                || msg.contains("block range too large") || msg.contains("log response size exceeded");
    }

    static boolean isRateLimited(Exception e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase();
        return msg.contains("429") || msg.contains("too many requests")
                || msg.contains("rate limit") || msg.contains("limit exceeded")
                || msg.contains("request limit") || msg.contains("-32005");
    }

    private String nextEndpoint(RpcEndpointRotator rotator) {
        long nowMs = System.currentTimeMillis();
        List<String> endpoints = rotator.getEndpoints();
        for (int i = 0; i < endpoints.size(); i++) {
            String endpoint = rotator.getNextEndpoint();
            Long cooldownUntil = endpointCooldownUntilMs.get(endpoint);
            if (cooldownUntil == null || cooldownUntil <= nowMs) {
                return endpoint;
            }
            log.debug("Skipping cooled-down endpoint {} for {} ms", endpoint, cooldownUntil - nowMs);
        }
        return rotator.getNextEndpoint();
    }

    private void markEndpointCoolingDown(String endpoint, Exception cause) {
        long cooldownMs = Math.max(1_000L, evmRpcProperties.getEndpointCooldownMs());
        long nowMs = System.currentTimeMillis();
        Long prevUntil = endpointCooldownUntilMs.put(endpoint, nowMs + cooldownMs);
        if (prevUntil == null || prevUntil <= nowMs) {
            log.warn("Endpoint {} cooled down for {} ms due to suspected rate limit: {}",
                    endpoint, cooldownMs, messageOf(cause));
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during retry", e);
        }
    }

    private static String messageOf(Exception e) {
        if (e == null || e.getMessage() == null || e.getMessage().isBlank()) {
            return "unknown";
        }
        return e.getMessage();
    }
}
