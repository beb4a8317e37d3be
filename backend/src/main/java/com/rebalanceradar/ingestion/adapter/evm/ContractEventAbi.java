package com.rebalanceradar.ingestion.adapter.evm;

import com.rebalanceradar.ingestion.event.EventKind;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Event signatures emitted by the strategy registry and rebalance executor contracts, keyed by topic0.
 */
public final class ContractEventAbi {

    /** One ABI input; the name becomes the key in the decoded argument map. */
    public record Param(String name, TypeReference<?> type) {

        public boolean indexed() {
            return type.isIndexed();
        }
    }

    public record Definition(EventKind kind, Event event, List<Param> params, String topic0) {

        public List<Param> indexedParams() {
            return params.stream().filter(Param::indexed).toList();
        }

        public List<Param> nonIndexedParams() {
            return params.stream().filter(p -> !p.indexed()).toList();
        }
    }

    private static final Map<String, Definition> BY_TOPIC;

    static {
        Map<String, Definition> byTopic = new LinkedHashMap<>();
        register(byTopic, EventKind.STRATEGY_CREATED,
                indexedAddress("user"), indexedUint("strategyId"), string("name"), addressArray("tokens"), uintArray("weights"));
        register(byTopic, EventKind.STRATEGY_UPDATED,
                indexedAddress("user"), indexedUint("strategyId"), addressArray("tokens"), uintArray("weights"));
        register(byTopic, EventKind.STRATEGY_PAUSED, indexedAddress("user"), indexedUint("strategyId"));
        register(byTopic, EventKind.STRATEGY_RESUMED, indexedAddress("user"), indexedUint("strategyId"));
        register(byTopic, EventKind.STRATEGY_DELETED, indexedAddress("user"), indexedUint("strategyId"));
        register(byTopic, EventKind.LAST_REBALANCE_TIME_UPDATED,
                indexedAddress("user"), indexedUint("strategyId"), uint("timestamp"));
        register(byTopic, EventKind.EXECUTOR_UPDATED, indexedAddress("oldExecutor"), indexedAddress("newExecutor"));
        register(byTopic, EventKind.REBALANCE_EXECUTED,
                indexedAddress("user"), indexedUint("strategyId"), uint("timestamp"), uint("drift"), uint("gasReimbursed"));
        register(byTopic, EventKind.REBALANCE_FAILED, indexedAddress("user"), indexedUint("strategyId"), string("reason"));
        register(byTopic, EventKind.SWAP_EXECUTED,
                indexedAddress("user"), address("tokenIn"), address("tokenOut"), uint("amountIn"), uint("amountOut"));
        register(byTopic, EventKind.DEX_APPROVAL_UPDATED, indexedAddress("dex"), bool("approved"));
        register(byTopic, EventKind.EMERGENCY_PAUSED, indexedAddress("caller"));
        register(byTopic, EventKind.EMERGENCY_UNPAUSED, indexedAddress("caller"));
        BY_TOPIC = Collections.unmodifiableMap(byTopic);
    }

    private ContractEventAbi() {
    }

    public static Optional<Definition> byTopic(String topic0) {
        return topic0 == null ? Optional.empty() : Optional.ofNullable(BY_TOPIC.get(topic0.toLowerCase(Locale.ROOT)));
    }

    public static Definition of(EventKind kind) {
        return BY_TOPIC.values().stream()
                .filter(d -> d.kind() == kind)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No ABI for " + kind));
    }

    /** All topic0 hashes, for the eth_getLogs filter. */
    public static List<String> topics() {
        return List.copyOf(BY_TOPIC.keySet());
    }

    private static void register(Map<String, Definition> byTopic, EventKind kind, Param... params) {
        List<TypeReference<?>> types = new ArrayList<>();
        for (Param p : params) {
            types.add(p.type());
        }
        Event event = new Event(kind.eventName(), types);
        String topic0 = EventEncoder.encode(event).toLowerCase(Locale.ROOT);
        byTopic.put(topic0, new Definition(kind, event, List.of(params), topic0));
    }

    private static Param indexedAddress(String name) {
        return new Param(name, new TypeReference<Address>(true) {
        });
    }

    private static Param indexedUint(String name) {
        return new Param(name, new TypeReference<Uint256>(true) {
        });
    }

    private static Param address(String name) {
        return new Param(name, new TypeReference<Address>() {
        });
    }

    private static Param uint(String name) {
        return new Param(name, new TypeReference<Uint256>() {
        });
    }

    private static Param bool(String name) {
        return new Param(name, new TypeReference<Bool>() {
        });
    }

    private static Param string(String name) {
        return new Param(name, new TypeReference<Utf8String>() {
        });
    }

    private static Param addressArray(String name) {
        return new Param(name, new TypeReference<DynamicArray<Address>>() {
        });
    }

    private static Param uintArray(String name) {
        return new Param(name, new TypeReference<DynamicArray<Uint256>>() {
        });
    }
}
