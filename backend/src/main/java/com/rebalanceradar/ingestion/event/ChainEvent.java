package com.rebalanceradar.ingestion.event;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Typed contract events, decoded once from {@link RawChainEvent} at the queue boundary.
 * Addresses are lowercased; amounts are raw integer units.
 */
public sealed interface ChainEvent {

    EventMeta meta();

    EventKind kind();

    /** Events owned by one user's strategy. */
    sealed interface StrategyScoped extends ChainEvent {

        String user();

        BigInteger strategyId();
    }

    record StrategyCreated(EventMeta meta, String user, BigInteger strategyId, String name,
                           List<String> tokens, List<Long> weights) implements StrategyScoped {
        public EventKind kind() {
            return EventKind.STRATEGY_CREATED;
        }
    }

    record StrategyUpdated(EventMeta meta, String user, BigInteger strategyId,
                           List<String> tokens, List<Long> weights) implements StrategyScoped {
        public EventKind kind() {
            return EventKind.STRATEGY_UPDATED;
        }
    }

    record StrategyPaused(EventMeta meta, String user, BigInteger strategyId) implements StrategyScoped {
        public EventKind kind() {
            return EventKind.STRATEGY_PAUSED;
        }
    }

    record StrategyResumed(EventMeta meta, String user, BigInteger strategyId) implements StrategyScoped {
        public EventKind kind() {
            return EventKind.STRATEGY_RESUMED;
        }
    }

    record StrategyDeleted(EventMeta meta, String user, BigInteger strategyId) implements StrategyScoped {
        public EventKind kind() {
            return EventKind.STRATEGY_DELETED;
        }
    }

    record LastRebalanceTimeUpdated(EventMeta meta, String user, BigInteger strategyId,
                                    Instant lastRebalanceTime) implements StrategyScoped {
        public EventKind kind() {
            return EventKind.LAST_REBALANCE_TIME_UPDATED;
        }
    }

    /**
     * gasUsed, gasPrice and executor come from the transaction receipt and may be null when it was unavailable.
     */
    record RebalanceExecuted(EventMeta meta, String user, BigInteger strategyId, Instant executedAt,
                             long drift, BigInteger gasReimbursed, BigInteger gasUsed, BigInteger gasPrice,
                             String executor) implements StrategyScoped {
        public EventKind kind() {
            return EventKind.REBALANCE_EXECUTED;
        }

        public double driftPercentage() {
            return drift / 100.0;
        }
    }

    record RebalanceFailed(EventMeta meta, String user, BigInteger strategyId, String reason) implements StrategyScoped {
        public EventKind kind() {
            return EventKind.REBALANCE_FAILED;
        }
    }

    record SwapExecuted(EventMeta meta, String user, String tokenIn, String tokenOut,
                        BigInteger amountIn, BigInteger amountOut) implements ChainEvent {
        public EventKind kind() {
            return EventKind.SWAP_EXECUTED;
        }
    }

    record DexApprovalUpdated(EventMeta meta, String dex, boolean approved) implements ChainEvent {
        public EventKind kind() {
            return EventKind.DEX_APPROVAL_UPDATED;
        }
    }

    record EmergencyPaused(EventMeta meta, String caller) implements ChainEvent {
        public EventKind kind() {
            return EventKind.EMERGENCY_PAUSED;
        }
    }

    record EmergencyUnpaused(EventMeta meta, String caller) implements ChainEvent {
        public EventKind kind() {
            return EventKind.EMERGENCY_UNPAUSED;
        }
    }

    record ExecutorUpdated(EventMeta meta, String oldExecutor, String newExecutor) implements ChainEvent {
        public EventKind kind() {
            return EventKind.EXECUTOR_UPDATED;
        }
    }
}
