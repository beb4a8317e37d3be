package com.rebalanceradar.ingestion.event;

import java.util.Arrays;
import java.util.Optional;

/**
 * Contract event names handled by the reducer.
 */
public enum EventKind {
    STRATEGY_CREATED("StrategyCreated"),
    STRATEGY_UPDATED("StrategyUpdated"),
    STRATEGY_PAUSED("StrategyPaused"),
    STRATEGY_RESUMED("StrategyResumed"),
    STRATEGY_DELETED("StrategyDeleted"),
    LAST_REBALANCE_TIME_UPDATED("LastRebalanceTimeUpdated"),
    REBALANCE_EXECUTED("RebalanceExecuted"),
    REBALANCE_FAILED("RebalanceFailed"),
    SWAP_EXECUTED("SwapExecuted"),
    DEX_APPROVAL_UPDATED("DEXApprovalUpdated"),
    EMERGENCY_PAUSED("EmergencyPaused"),
    EMERGENCY_UNPAUSED("EmergencyUnpaused"),
    EXECUTOR_UPDATED("RebalanceExecutorUpdated");

    private final String eventName;

    EventKind(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }

    public static Optional<EventKind> fromEventName(String eventName) {
        return Arrays.stream(values()).filter(k -> k.eventName.equals(eventName)).findFirst();
    }
}
