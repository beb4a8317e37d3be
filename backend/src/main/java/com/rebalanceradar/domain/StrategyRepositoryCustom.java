package com.rebalanceradar.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Single-document atomic transitions on strategies. Guards live in the update filter, so a
 * stale, duplicate or post-delete event matches nothing.
 */
public interface StrategyRepositoryCustom {

    /**
     * Sets the paused flag if the strategy is active and the event is newer than the last pause/resume.
     *
     * @return true if the document changed
     */
    boolean applyPauseState(String strategyKey, boolean paused, long position, Instant blockTimestamp);

    /**
     * Replaces tokens and weights if the strategy is active and the event is newer than the last allocation change.
     */
    boolean applyAllocation(String strategyKey, List<String> tokens, List<Long> weights, long position, Instant blockTimestamp);

    /**
     * active: true → false. Matches only once per strategy.
     */
    boolean markDeleted(String strategyKey, Instant blockTimestamp);

    /** Moves lastRebalanceTime forward only. */
    boolean advanceLastRebalanceTime(String strategyKey, Instant lastRebalanceTime, Instant blockTimestamp);

    /**
     * Folds a successful rebalance into the running statistics: averageDrift and totalRebalances move
     * together in one pipeline update.
     */
    void recordRebalance(String strategyKey, double driftPercentage, BigDecimal gasSpentWei,
                         Instant executedAt, Instant blockTimestamp);

    void recordSwap(String strategyKey, BigDecimal volume);
}
