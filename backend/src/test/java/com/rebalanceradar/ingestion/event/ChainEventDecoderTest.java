package com.rebalanceradar.ingestion.event;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChainEventDecoderTest {

    private static final Instant TS = Instant.parse("2025-03-01T12:00:00Z");

    private final ChainEventDecoder decoder = new ChainEventDecoder();

    @Test
    void decode_strategyCreated() {
        ChainEvent event = decoder.decode(raw("StrategyCreated", Map.of(
                "user", "0xABCD", "strategyId", "7", "name", "Core",
                "tokens", List.of("0xAA", "0xbb"), "weights", List.of("6000", "4000"))));

        assertThat(event).isInstanceOf(ChainEvent.StrategyCreated.class);
        ChainEvent.StrategyCreated created = (ChainEvent.StrategyCreated) event;
        assertThat(created.user()).isEqualTo("0xabcd");
        assertThat(created.strategyId()).isEqualTo(BigInteger.valueOf(7));
        assertThat(created.tokens()).containsExactly("0xaa", "0xbb");
        assertThat(created.weights()).containsExactly(6000L, 4000L);
        assertThat(created.meta().position()).isEqualTo(120L * 1_000_000L + 4);
        assertThat(created.meta().recordKey()).isEqualTo("10143-0xtx-4");
    }

    @Test
    void decode_rebalanceExecuted_receiptFieldsOptional() {
        ChainEvent.RebalanceExecuted executed = (ChainEvent.RebalanceExecuted) decoder.decode(raw("RebalanceExecuted", Map.of(
                "user", "0xabcd", "strategyId", "1", "timestamp", "1740830400", "drift", "525", "gasReimbursed", "1000")));

        assertThat(executed.executedAt()).isEqualTo(Instant.ofEpochSecond(1740830400L));
        assertThat(executed.driftPercentage()).isEqualTo(5.25);
        assertThat(executed.gasUsed()).isNull();
        assertThat(executed.executor()).isNull();
    }

    @Test
    void decode_dexApproval_acceptsStringBoolean() {
        ChainEvent.DexApprovalUpdated event = (ChainEvent.DexApprovalUpdated) decoder.decode(
                raw("DEXApprovalUpdated", Map.of("dex", "0xDEX", "approved", "true")));

        assertThat(event.approved()).isTrue();
        assertThat(event.dex()).isEqualTo("0xdex");
    }

    @Test
    void decode_unknownEventName_throws() {
        assertThatThrownBy(() -> decoder.decode(raw("Transfer", Map.of())))
                .isInstanceOf(EventDecodingException.class)
                .hasMessageContaining("Unknown event Transfer");
    }

    @Test
    void decode_missingArgument_throws() {
        assertThatThrownBy(() -> decoder.decode(raw("StrategyPaused", Map.of("user", "0xabcd"))))
                .isInstanceOf(EventDecodingException.class)
                .hasMessageContaining("strategyId");
    }

    @Test
    void decode_malformedNumber_throws() {
        assertThatThrownBy(() -> decoder.decode(raw("StrategyPaused", Map.of("user", "0xabcd", "strategyId", "seven"))))
                .isInstanceOf(EventDecodingException.class)
                .hasMessageContaining("Malformed StrategyPaused");
    }

    @Test
    void decode_nonListWhereListExpected_throws() {
        assertThatThrownBy(() -> decoder.decode(raw("StrategyUpdated", Map.of(
                "user", "0xabcd", "strategyId", "1", "tokens", "0xaa", "weights", List.of("1")))))
                .isInstanceOf(EventDecodingException.class)
                .hasMessageContaining("not a list");
    }

    private static RawChainEvent raw(String name, Map<String, Object> data) {
        return new RawChainEvent(10143L, name, 120L, TS, "0xTX", 4L, data);
    }
}
