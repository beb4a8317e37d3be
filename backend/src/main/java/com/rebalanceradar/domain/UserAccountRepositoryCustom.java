package com.rebalanceradar.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Atomic counter updates on users. Each call upserts the user on first sight.
 */
public interface UserAccountRepositoryCustom {

    void recordStrategyCreated(String userAddress, Instant activityAt);

    /** Decrements strategyCount, never below zero. */
    void recordStrategyDeleted(String userAddress, Instant activityAt);

    void recordRebalance(String userAddress, BigDecimal gasSpentWei, Instant activityAt);
}
