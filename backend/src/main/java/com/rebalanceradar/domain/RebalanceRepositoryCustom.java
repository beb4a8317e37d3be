package com.rebalanceradar.domain;

import java.math.BigDecimal;

/**
 * Swap roll-ups on a rebalance.
 */
public interface RebalanceRepositoryCustom {

    void recordSwap(String rebalanceId, BigDecimal amountIn, BigDecimal amountOut);
}
