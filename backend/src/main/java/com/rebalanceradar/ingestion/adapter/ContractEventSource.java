package com.rebalanceradar.ingestion.adapter;

import com.rebalanceradar.domain.SupportedChain;
import com.rebalanceradar.ingestion.adapter.evm.ContractEventAbi;
import com.rebalanceradar.ingestion.adapter.evm.EvmLogDecoder;
import com.rebalanceradar.ingestion.config.IngestionChainProperties;
import com.rebalanceradar.ingestion.event.EventDecodingException;
import com.rebalanceradar.ingestion.event.EventKind;
import com.rebalanceradar.ingestion.event.RawChainEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fetches and decodes the contract events of a block range on one chain. Shared by the backfill
 * scanner and the live subscriber so both produce identical {@link RawChainEvent}s.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContractEventSource {

    private final ChainClient chainClient;
    private final EvmLogDecoder logDecoder;
    private final IngestionChainProperties chainProperties;

    /**
     * Events in [fromBlock, toBlock], ordered by (blockNumber, logIndex). Logs with an unknown topic
     * or undecodable payload are skipped with a warning.
     */
    public List<RawChainEvent> fetchEvents(SupportedChain chain, long fromBlock, long toBlock) {
        LogFilter filter = filterFor(chain);
        if (filter.addresses().isEmpty()) {
            log.warn("No contract addresses configured for {}; nothing to fetch", chain);
            return List.of();
        }
        List<ChainLog> logs = chainClient.getLogs(chain, fromBlock, toBlock, filter);
        Map<Long, Instant> timestamps = new HashMap<>();
        List<RawChainEvent> events = new ArrayList<>(logs.size());
        for (ChainLog chainLog : logs) {
            Optional<EvmLogDecoder.DecodedLog> decoded;
            try {
                decoded = logDecoder.decode(chainLog);
            } catch (EventDecodingException e) {
                log.warn("Skipping undecodable log {}:{} on {}: {}", chainLog.transactionHash(), chainLog.logIndex(),
                        chain, e.getMessage());
                continue;
            }
            if (decoded.isEmpty()) {
                log.debug("Skipping log with unknown topic {}:{} on {}", chainLog.transactionHash(), chainLog.logIndex(), chain);
                continue;
            }
            Instant blockTimestamp = chainLog.blockTimestamp() != null
                    ? chainLog.blockTimestamp()
                    : timestamps.computeIfAbsent(chainLog.blockNumber(), b -> chainClient.getBlockTimestamp(chain, b));
            Map<String, Object> data = new LinkedHashMap<>(decoded.get().data());
            if (decoded.get().definition().kind() == EventKind.REBALANCE_EXECUTED) {
                addReceiptData(chain, chainLog.transactionHash(), data);
            }
            events.add(new RawChainEvent(chain.chainId(), decoded.get().eventName(), chainLog.blockNumber(),
                    blockTimestamp, chainLog.transactionHash(), chainLog.logIndex(), data));
        }
        events.sort(Comparator.comparingLong(RawChainEvent::blockNumber).thenComparingLong(RawChainEvent::logIndex));
        return events;
    }

    /** Gas actually paid for the rebalance transaction and who sent it. */
    private void addReceiptData(SupportedChain chain, String transactionHash, Map<String, Object> data) {
        chainClient.getTransactionReceipt(chain, transactionHash).ifPresentOrElse(receipt -> {
            if (receipt.gasUsed() != null) {
                data.put("gasUsed", receipt.gasUsed().toString());
            }
            if (receipt.effectiveGasPrice() != null) {
                data.put("gasPrice", receipt.effectiveGasPrice().toString());
            }
            if (receipt.from() != null && !receipt.from().isBlank()) {
                data.put("executor", receipt.from());
            }
        }, () -> log.warn("No receipt for rebalance tx {} on {}", transactionHash, chain));
    }

    LogFilter filterFor(SupportedChain chain) {
        IngestionChainProperties.ChainEntry entry = chainProperties.require(chain);
        List<String> addresses = entry.getContracts().values().stream()
                .filter(a -> a != null && !a.isBlank())
                .map(a -> a.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        return new LogFilter(addresses, ContractEventAbi.topics());
    }
}
