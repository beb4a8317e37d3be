package com.rebalanceradar.ingestion.event;

import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a {@link RawChainEvent} to its typed variant. Missing or malformed arguments raise
 * {@link EventDecodingException}.
 */
@Component
public class ChainEventDecoder {

    public ChainEvent decode(RawChainEvent raw) {
        EventKind kind = EventKind.fromEventName(raw.eventName())
                .orElseThrow(() -> new EventDecodingException("Unknown event " + raw.eventName() + " at " + raw.eventKey()));
        if (raw.transactionHash() == null || raw.blockTimestamp() == null) {
            throw new EventDecodingException("Missing tx hash or block timestamp at " + raw.eventKey());
        }
        EventMeta meta = new EventMeta(raw.chainId(), raw.transactionHash(), raw.blockNumber(), raw.logIndex(),
                raw.blockTimestamp());
        Args args = new Args(raw.data(), raw.eventKey());
        try {
            return switch (kind) {
                case STRATEGY_CREATED -> new ChainEvent.StrategyCreated(meta, args.address("user"), args.uint("strategyId"),
                        args.string("name"), args.addresses("tokens"), args.longs("weights"));
                case STRATEGY_UPDATED -> new ChainEvent.StrategyUpdated(meta, args.address("user"), args.uint("strategyId"),
                        args.addresses("tokens"), args.longs("weights"));
                case STRATEGY_PAUSED -> new ChainEvent.StrategyPaused(meta, args.address("user"), args.uint("strategyId"));
                case STRATEGY_RESUMED -> new ChainEvent.StrategyResumed(meta, args.address("user"), args.uint("strategyId"));
                case STRATEGY_DELETED -> new ChainEvent.StrategyDeleted(meta, args.address("user"), args.uint("strategyId"));
                case LAST_REBALANCE_TIME_UPDATED -> new ChainEvent.LastRebalanceTimeUpdated(meta, args.address("user"),
                        args.uint("strategyId"), args.epochSeconds("timestamp"));
                case REBALANCE_EXECUTED -> new ChainEvent.RebalanceExecuted(meta, args.address("user"), args.uint("strategyId"),
                        args.epochSeconds("timestamp"), args.uint("drift").longValueExact(), args.uint("gasReimbursed"),
                        args.optionalUint("gasUsed"), args.optionalUint("gasPrice"), args.optionalAddress("executor"));
                case REBALANCE_FAILED -> new ChainEvent.RebalanceFailed(meta, args.address("user"), args.uint("strategyId"),
                        args.string("reason"));
                case SWAP_EXECUTED -> new ChainEvent.SwapExecuted(meta, args.address("user"), args.address("tokenIn"),
                        args.address("tokenOut"), args.uint("amountIn"), args.uint("amountOut"));
                case DEX_APPROVAL_UPDATED -> new ChainEvent.DexApprovalUpdated(meta, args.address("dex"), args.bool("approved"));
                case EMERGENCY_PAUSED -> new ChainEvent.EmergencyPaused(meta, args.address("caller"));
                case EMERGENCY_UNPAUSED -> new ChainEvent.EmergencyUnpaused(meta, args.address("caller"));
                case EXECUTOR_UPDATED -> new ChainEvent.ExecutorUpdated(meta, args.address("oldExecutor"),
                        args.address("newExecutor"));
            };
        } catch (NumberFormatException | ArithmeticException | ClassCastException e) {
            throw new EventDecodingException("Malformed " + raw.eventName() + " at " + raw.eventKey() + ": " + e.getMessage(), e);
        }
    }

    private record Args(Map<String, Object> data, String eventKey) {

        Object required(String name) {
            Object value = data.get(name);
            if (value == null) {
                throw new EventDecodingException("Missing argument '" + name + "' at " + eventKey);
            }
            return value;
        }

        String string(String name) {
            return required(name).toString();
        }

        String address(String name) {
            return string(name).toLowerCase(Locale.ROOT);
        }

        String optionalAddress(String name) {
            Object value = data.get(name);
            return value == null ? null : value.toString().toLowerCase(Locale.ROOT);
        }

        BigInteger uint(String name) {
            return new BigInteger(string(name));
        }

        BigInteger optionalUint(String name) {
            Object value = data.get(name);
            return value == null ? null : new BigInteger(value.toString());
        }

        boolean bool(String name) {
            Object value = required(name);
            if (value instanceof Boolean b) {
                return b;
            }
            return Boolean.parseBoolean(value.toString());
        }

        Instant epochSeconds(String name) {
            return Instant.ofEpochSecond(uint(name).longValueExact());
        }

        List<String> addresses(String name) {
            return list(name).stream().map(v -> v.toString().toLowerCase(Locale.ROOT)).toList();
        }

        List<Long> longs(String name) {
            return list(name).stream().map(v -> new BigInteger(v.toString()).longValueExact()).toList();
        }

        List<?> list(String name) {
            Object value = required(name);
            if (!(value instanceof List<?> list)) {
                throw new EventDecodingException("Argument '" + name + "' is not a list at " + eventKey);
            }
            return list;
        }
    }
}
