package com.rebalanceradar.notification;

import java.util.Arrays;
import java.util.Optional;

/**
 * Change channels subscribers can listen on.
 */
public enum NotificationChannel {
    STRATEGY_CREATED("strategy:created"),
    STRATEGY_UPDATED("strategy:updated"),
    STRATEGY_PAUSED("strategy:paused"),
    STRATEGY_RESUMED("strategy:resumed"),
    STRATEGY_DELETED("strategy:deleted"),
    REBALANCE_COMPLETED("rebalance:completed"),
    REBALANCE_FAILED("rebalance:failed"),
    SWAP_EXECUTED("swap:executed"),
    EVENT_INDEXED("event:indexed"),
    GAS_UPDATED("gas:updated"),
    SYSTEM_ALERT("system:alert");

    private final String channelName;

    NotificationChannel(String channelName) {
        this.channelName = channelName;
    }

    public String channelName() {
        return channelName;
    }

    public static Optional<NotificationChannel> fromChannelName(String channelName) {
        return Arrays.stream(values()).filter(c -> c.channelName.equals(channelName)).findFirst();
    }
}
