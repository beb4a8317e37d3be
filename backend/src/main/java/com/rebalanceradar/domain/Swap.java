package com.rebalanceradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * A swap leg of a rebalance. Id = {chainId}-{txHash}-{logIndex}; swapIndex is the log distance
 * from the parent rebalance. Immutable apart from the roll-up ledger.
 */
@Document(collection = "swaps")
@CompoundIndex(name = "rebalance_swap", def = "{'rebalanceId': 1, 'swapIndex': 1}")
@CompoundIndex(name = "strategy_block", def = "{'strategyKey': 1, 'blockNumber': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Swap {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long chainId;
    private String rebalanceId;
    private String strategyKey;
    private String userAddress;
    private String txHash;
    private long blockNumber;
    private Instant blockTimestamp;
    private long logIndex;
    private long swapIndex;

    private String tokenIn;
    private String tokenOut;
    /** Raw uint256 token amounts, stored as decimal strings. */
    private BigInteger amountIn;
    private BigInteger amountOut;
    /** Best effort; stays null without a price source. */
    private Double priceImpact;

    private Set<String> appliedRollups = new HashSet<>();
}
