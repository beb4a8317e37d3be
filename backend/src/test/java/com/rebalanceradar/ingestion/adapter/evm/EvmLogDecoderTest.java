package com.rebalanceradar.ingestion.adapter.evm;

import com.rebalanceradar.ingestion.adapter.ChainLog;
import com.rebalanceradar.ingestion.event.EventDecodingException;
import com.rebalanceradar.ingestion.event.EventKind;
import org.junit.jupiter.api.Test;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvmLogDecoderTest {

    private static final String USER = "0x1111111111111111111111111111111111111111";
    private static final String TOKEN_A = "0x00000000000000000000000000000000000000aa";
    private static final String TOKEN_B = "0x00000000000000000000000000000000000000bb";

    private final EvmLogDecoder decoder = new EvmLogDecoder();

    @Test
    void decode_strategyCreated_mapsIndexedAndDataArguments() {
        String data = encode(
                new Utf8String("Blue chips"),
                new DynamicArray<>(Address.class, List.of(new Address(TOKEN_A), new Address(TOKEN_B))),
                new DynamicArray<>(Uint256.class, List.of(new Uint256(6000), new Uint256(4000))));
        ChainLog log = log(EventKind.STRATEGY_CREATED, List.of(topic(new Address(USER)), topic(new Uint256(7))), data);

        Optional<EvmLogDecoder.DecodedLog> decoded = decoder.decode(log);

        assertThat(decoded).isPresent();
        assertThat(decoded.get().eventName()).isEqualTo("StrategyCreated");
        Map<String, Object> args = decoded.get().data();
        assertThat(args).containsEntry("user", USER)
                .containsEntry("strategyId", "7")
                .containsEntry("name", "Blue chips");
        assertThat(args.get("tokens")).isEqualTo(List.of(TOKEN_A, TOKEN_B));
        assertThat(args.get("weights")).isEqualTo(List.of("6000", "4000"));
    }

    @Test
    void decode_swapExecuted_keepsFullUint256Precision() {
        BigInteger huge = BigInteger.TWO.pow(200).add(BigInteger.ONE);
        String data = encode(new Address(TOKEN_A), new Address(TOKEN_B), new Uint256(huge), new Uint256(5));
        ChainLog log = log(EventKind.SWAP_EXECUTED, List.of(topic(new Address(USER))), data);

        Map<String, Object> args = decoder.decode(log).orElseThrow().data();

        assertThat(args).containsEntry("tokenIn", TOKEN_A)
                .containsEntry("tokenOut", TOKEN_B)
                .containsEntry("amountIn", huge.toString())
                .containsEntry("amountOut", "5");
    }

    @Test
    void decode_dexApproval_mapsBoolean() {
        ChainLog log = log(EventKind.DEX_APPROVAL_UPDATED, List.of(topic(new Address(TOKEN_A))), encode(new Bool(false)));

        Map<String, Object> args = decoder.decode(log).orElseThrow().data();

        assertThat(args).containsEntry("dex", TOKEN_A).containsEntry("approved", false);
    }

    @Test
    void decode_eventWithoutDataArguments() {
        ChainLog log = log(EventKind.EMERGENCY_PAUSED, List.of(topic(new Address(USER))), "0x");

        assertThat(decoder.decode(log).orElseThrow().data()).containsExactly(Map.entry("caller", USER));
    }

    @Test
    void decode_unknownTopic_returnsEmpty() {
        ChainLog log = new ChainLog("0xcontract", List.of("0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef"),
                "0x", 1, "0xtx", 0, null);

        assertThat(decoder.decode(log)).isEmpty();
        assertThat(decoder.decode(new ChainLog("0xcontract", List.of(), "0x", 1, "0xtx", 0, null))).isEmpty();
    }

    @Test
    void decode_wrongIndexedTopicCount_throws() {
        ChainLog log = log(EventKind.STRATEGY_PAUSED, List.of(topic(new Address(USER))), "0x");

        assertThatThrownBy(() -> decoder.decode(log))
                .isInstanceOf(EventDecodingException.class)
                .hasMessageContaining("StrategyPaused expects 2 indexed topics");
    }

    @Test
    void decode_missingData_throws() {
        ChainLog log = log(EventKind.REBALANCE_FAILED, List.of(topic(new Address(USER)), topic(new Uint256(1))), "0x");

        assertThatThrownBy(() -> decoder.decode(log)).isInstanceOf(EventDecodingException.class);
    }

    @Test
    void topics_coverEveryEventKind() {
        assertThat(ContractEventAbi.topics()).hasSize(EventKind.values().length);
        for (EventKind kind : EventKind.values()) {
            ContractEventAbi.Definition definition = ContractEventAbi.byTopic(ContractEventAbi.of(kind).topic0()).orElseThrow();
            assertThat(definition.kind()).isEqualTo(kind);
        }
    }

    private static ChainLog log(EventKind kind, List<String> indexedTopics, String data) {
        List<String> topics = new ArrayList<>();
        topics.add(ContractEventAbi.of(kind).topic0());
        topics.addAll(indexedTopics);
        return new ChainLog("0xcontract", topics, data, 100, "0xtx", 3, null);
    }

    private static String topic(Type<?> value) {
        return "0x" + TypeEncoder.encode(value);
    }

    @SuppressWarnings("rawtypes")
    private static String encode(Type... values) {
        return "0x" + FunctionEncoder.encodeConstructor(List.of(values));
    }
}
