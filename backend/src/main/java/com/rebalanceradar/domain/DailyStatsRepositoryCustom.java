package com.rebalanceradar.domain;

import java.math.BigDecimal;

/**
 * Additive upserts on daily_stats. The row is created on the first event of the day.
 */
public interface DailyStatsRepositoryCustom {

    void recordStrategyCreated(long chainId, String date, String userAddress, String strategyKey);

    void recordRebalance(long chainId, String date, double driftPercentage, BigDecimal gasSpentWei,
                         String userAddress, String strategyKey);

    void recordRebalanceFailed(long chainId, String date, String userAddress, String strategyKey);

    void recordSwap(long chainId, String date, BigDecimal volume);
}
