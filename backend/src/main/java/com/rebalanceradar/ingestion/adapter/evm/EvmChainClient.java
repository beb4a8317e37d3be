package com.rebalanceradar.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.rebalanceradar.common.HexQuantity;
import com.rebalanceradar.domain.SupportedChain;
import com.rebalanceradar.ingestion.adapter.ChainClient;
import com.rebalanceradar.ingestion.adapter.ChainLog;
import com.rebalanceradar.ingestion.adapter.LogFilter;
import com.rebalanceradar.ingestion.adapter.RpcException;
import com.rebalanceradar.ingestion.adapter.TransactionReceipt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ChainClient} over EVM JSON-RPC. eth_getLogs ranges the provider rejects as too wide are
 * split in halves until they pass.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvmChainClient implements ChainClient {

    /** Ranges narrower than this are not split further. */
    static final long MIN_SPLIT_RANGE = 1;

    private final EvmRpcGateway gateway;
    private final EvmBlockTimestampResolver timestampResolver;

    @Override
    public long getLatestBlock(SupportedChain chain) {
        JsonNode result = gateway.call(chain, "eth_blockNumber", List.of());
        return HexQuantity.parseLong(requireText(result, "eth_blockNumber"));
    }

    @Override
    public List<ChainLog> getLogs(SupportedChain chain, long fromBlock, long toBlock, LogFilter filter) {
        if (fromBlock > toBlock) {
            return List.of();
        }
        try {
            JsonNode result = gateway.call(chain, "eth_getLogs", List.of(buildLogFilter(fromBlock, toBlock, filter)));
            return parseLogs(result);
        } catch (RpcException e) {
            if (EvmRpcGateway.isRangeTooWideError(e) && toBlock - fromBlock >= MIN_SPLIT_RANGE) {
                long mid = fromBlock + (toBlock - fromBlock) / 2;
                log.warn("Splitting eth_getLogs range [{}-{}] on {}: {}", fromBlock, toBlock, chain, e.getMessage());
                List<ChainLog> combined = new ArrayList<>(getLogs(chain, fromBlock, mid, filter));
                combined.addAll(getLogs(chain, mid + 1, toBlock, filter));
                return combined;
            }
            throw e;
        }
    }

    @Override
    public Optional<TransactionReceipt> getTransactionReceipt(SupportedChain chain, String transactionHash) {
        JsonNode result = gateway.call(chain, "eth_getTransactionReceipt", List.of(transactionHash));
        if (result == null || result.isNull() || result.isMissingNode()) {
            return Optional.empty();
        }
        String effectiveGasPrice = result.path("effectiveGasPrice").asText(null);
        String gasUsed = result.path("gasUsed").asText(null);
        return Optional.of(new TransactionReceipt(
                result.path("transactionHash").asText(transactionHash).toLowerCase(),
                result.path("from").asText("").toLowerCase(),
                gasUsed != null ? HexQuantity.parseBigInteger(gasUsed) : null,
                effectiveGasPrice != null ? HexQuantity.parseBigInteger(effectiveGasPrice) : null,
                "0x1".equals(result.path("status").asText())));
    }

    @Override
    public Instant getBlockTimestamp(SupportedChain chain, long blockNumber) {
        return timestampResolver.resolve(chain, blockNumber);
    }

    @Override
    public BigInteger getGasPrice(SupportedChain chain) {
        JsonNode result = gateway.call(chain, "eth_gasPrice", List.of());
        return HexQuantity.parseBigInteger(requireText(result, "eth_gasPrice"));
    }

    private static Map<String, Object> buildLogFilter(long fromBlock, long toBlock, LogFilter filter) {
        Map<String, Object> f = new HashMap<>();
        f.put("fromBlock", HexQuantity.toHex(fromBlock));
        f.put("toBlock", HexQuantity.toHex(toBlock));
        if (!filter.addresses().isEmpty()) {
            f.put("address", filter.addresses());
        }
        if (!filter.topic0Any().isEmpty()) {
            List<Object> topics = new ArrayList<>();
            topics.add(filter.topic0Any());
            f.put("topics", topics);
        }
        return f;
    }

    private static List<ChainLog> parseLogs(JsonNode result) {
        if (result == null || !result.isArray()) {
            throw new RpcException("eth_getLogs returned no array");
        }
        List<ChainLog> logs = new ArrayList<>(result.size());
        for (JsonNode node : result) {
            if (node.path("removed").asBoolean(false)) {
                continue;
            }
            List<String> topics = new ArrayList<>();
            node.path("topics").forEach(t -> topics.add(t.asText().toLowerCase()));
            String timestamp = node.path("blockTimestamp").asText(null);
            logs.add(new ChainLog(
                    node.path("address").asText("").toLowerCase(),
                    topics,
                    node.path("data").asText("0x"),
                    HexQuantity.parseLong(node.path("blockNumber").asText()),
                    node.path("transactionHash").asText().toLowerCase(),
                    HexQuantity.parseLong(node.path("logIndex").asText()),
                    timestamp != null ? Instant.ofEpochSecond(HexQuantity.parseLong(timestamp)) : null));
        }
        return logs;
    }

    private static String requireText(JsonNode result, String method) {
        if (result == null || !result.isTextual()) {
            throw new RpcException(method + " returned no result");
        }
        return result.asText();
    }
}
