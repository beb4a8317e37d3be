package com.rebalanceradar.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.rebalanceradar.common.HexQuantity;
import com.rebalanceradar.config.CaffeineConfig;
import com.rebalanceradar.domain.SupportedChain;
import com.rebalanceradar.ingestion.adapter.RpcException;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Block number to block timestamp via eth_getBlockByNumber, cached per chain and block.
 */
@Component
@RequiredArgsConstructor
public class EvmBlockTimestampResolver {

    private final EvmRpcGateway gateway;

    @Cacheable(cacheNames = CaffeineConfig.BLOCK_TIMESTAMP_CACHE, key = "#p0.name() + ':' + #p1")
    public Instant resolve(SupportedChain chain, long blockNumber) {
        JsonNode block = gateway.call(chain, "eth_getBlockByNumber", List.of(HexQuantity.toHex(blockNumber), false));
        if (block == null || block.isNull() || block.isMissingNode()) {
            throw new RpcException("Block " + blockNumber + " not found on " + chain);
        }
        String timestamp = block.path("timestamp").asText(null);
        if (timestamp == null) {
            throw new RpcException("Block " + blockNumber + " on " + chain + " has no timestamp");
        }
        return Instant.ofEpochSecond(HexQuantity.parseLong(timestamp));
    }
}
