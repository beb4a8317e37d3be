package com.rebalanceradar.ingestion.adapter;

import com.rebalanceradar.domain.SupportedChain;
import com.rebalanceradar.ingestion.adapter.evm.ContractEventAbi;
import com.rebalanceradar.ingestion.adapter.evm.EvmLogDecoder;
import com.rebalanceradar.ingestion.config.IngestionChainProperties;
import com.rebalanceradar.ingestion.event.EventDecodingException;
import com.rebalanceradar.ingestion.event.EventKind;
import com.rebalanceradar.ingestion.event.RawChainEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContractEventSourceTest {

    private static final SupportedChain CHAIN = SupportedChain.BASE_SEPOLIA;
    private static final Instant BLOCK_TIME = Instant.parse("2025-03-01T00:00:00Z");

    @Mock private ChainClient chainClient;
    @Mock private EvmLogDecoder logDecoder;

    private IngestionChainProperties properties;
    private ContractEventSource source;

    @BeforeEach
    void setUp() {
        properties = new IngestionChainProperties();
        IngestionChainProperties.ChainEntry entry = new IngestionChainProperties.ChainEntry();
        entry.setUrls(List.of("https://sepolia.base.org"));
        entry.setContracts(new LinkedHashMap<>(Map.of("strategy-registry", "0xREGISTRY", "rebalance-executor", "0xexecutor")));
        properties.setChains(Map.of(CHAIN.name(), entry));
        source = new ContractEventSource(chainClient, logDecoder, properties);
    }

    @Test
    void filterFor_lowercasesAddressesAndListsAllTopics() {
        LogFilter filter = source.filterFor(CHAIN);

        assertThat(filter.addresses()).containsExactlyInAnyOrder("0xregistry", "0xexecutor");
        assertThat(filter.topic0Any()).containsExactlyInAnyOrderElementsOf(ContractEventAbi.topics());
    }

    @Test
    void fetchEvents_sortsByPositionAndResolvesTimestampOncePerBlock() {
        ChainLog late = log("0xb", 11, 0);
        ChainLog early = log("0xa", 10, 5);
        ChainLog earlySameBlock = log("0xa", 10, 2);
        when(chainClient.getLogs(eq(CHAIN), eq(10L), eq(11L), any())).thenReturn(List.of(late, early, earlySameBlock));
        when(logDecoder.decode(any())).thenReturn(decoded(EventKind.STRATEGY_PAUSED, Map.of("user", "0xu", "strategyId", "1")));
        when(chainClient.getBlockTimestamp(eq(CHAIN), anyLong())).thenReturn(BLOCK_TIME);

        List<RawChainEvent> events = source.fetchEvents(CHAIN, 10, 11);

        assertThat(events).extracting(RawChainEvent::blockNumber, RawChainEvent::logIndex)
                .containsExactly(
                        tuple(10L, 2L),
                        tuple(10L, 5L),
                        tuple(11L, 0L));
        assertThat(events).allSatisfy(e -> {
            assertThat(e.chainId()).isEqualTo(84532L);
            assertThat(e.eventName()).isEqualTo("StrategyPaused");
            assertThat(e.blockTimestamp()).isEqualTo(BLOCK_TIME);
        });
        verify(chainClient, times(1)).getBlockTimestamp(CHAIN, 10L);
        verify(chainClient, times(1)).getBlockTimestamp(CHAIN, 11L);
    }

    @Test
    void fetchEvents_rebalanceExecuted_addsReceiptGasAndExecutor() {
        ChainLog log = new ChainLog("0xexecutor", List.of("0x01"), "0x", 20, "0xreb", 1, BLOCK_TIME);
        when(chainClient.getLogs(eq(CHAIN), eq(20L), eq(20L), any())).thenReturn(List.of(log));
        when(logDecoder.decode(log)).thenReturn(decoded(EventKind.REBALANCE_EXECUTED,
                Map.of("user", "0xu", "strategyId", "1", "timestamp", "1", "drift", "100", "gasReimbursed", "0")));
        when(chainClient.getTransactionReceipt(CHAIN, "0xreb")).thenReturn(Optional.of(
                new TransactionReceipt("0xreb", "0xkeeper", BigInteger.valueOf(21_000), BigInteger.valueOf(3), true)));

        List<RawChainEvent> events = source.fetchEvents(CHAIN, 20, 20);

        assertThat(events).hasSize(1);
        assertThat(events.get(0).data())
                .containsEntry("gasUsed", "21000")
                .containsEntry("gasPrice", "3")
                .containsEntry("executor", "0xkeeper");
        verify(chainClient, never()).getBlockTimestamp(any(), anyLong());
    }

    @Test
    void fetchEvents_skipsUnknownAndUndecodableLogs() {
        ChainLog unknown = log("0x1", 5, 0);
        ChainLog broken = log("0x2", 5, 1);
        ChainLog good = log("0x3", 5, 2);
        when(chainClient.getLogs(eq(CHAIN), eq(5L), eq(5L), any())).thenReturn(List.of(unknown, broken, good));
        when(logDecoder.decode(unknown)).thenReturn(Optional.empty());
        when(logDecoder.decode(broken)).thenThrow(new EventDecodingException("bad data"));
        when(logDecoder.decode(good)).thenReturn(decoded(EventKind.EMERGENCY_PAUSED, Map.of("caller", "0xc")));
        when(chainClient.getBlockTimestamp(CHAIN, 5L)).thenReturn(BLOCK_TIME);

        List<RawChainEvent> events = source.fetchEvents(CHAIN, 5, 5);

        assertThat(events).extracting(RawChainEvent::transactionHash).containsExactly("0x3");
    }

    @Test
    void fetchEvents_noContractAddresses_returnsEmptyWithoutCall() {
        properties.require(CHAIN).setContracts(Map.of("strategy-registry", ""));

        assertThat(source.fetchEvents(CHAIN, 1, 100)).isEmpty();
        verify(chainClient, never()).getLogs(any(), anyLong(), anyLong(), any());
    }

    private static ChainLog log(String txHash, long block, long logIndex) {
        return new ChainLog("0xregistry", List.of("0x01"), "0x", block, txHash, logIndex, null);
    }

    private static Optional<EvmLogDecoder.DecodedLog> decoded(EventKind kind, Map<String, Object> data) {
        return Optional.of(new EvmLogDecoder.DecodedLog(ContractEventAbi.of(kind), data));
    }
}
