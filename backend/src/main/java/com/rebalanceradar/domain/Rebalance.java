package com.rebalanceradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * One executed or failed rebalance. Id = {chainId}-{txHash}-{logIndex}.
 * Created once; afterwards only the swap roll-ups change.
 */
@Document(collection = "rebalances")
@CompoundIndex(name = "chain_tx_log", def = "{'chainId': 1, 'txHash': 1, 'logIndex': -1}")
@CompoundIndex(name = "strategy_block", def = "{'strategyKey': 1, 'blockNumber': -1}")
@CompoundIndex(name = "user_chain", def = "{'userAddress': 1, 'chainId': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Rebalance {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long chainId;
    private String strategyKey;
    private String userAddress;
    private String txHash;
    private long blockNumber;
    private Instant blockTimestamp;
    private long logIndex;

    private RebalanceStatus status;
    private String failureReason;
    /** Basis points. */
    private long drift;
    private double driftPercentage;
    /** Raw uint256 values, stored as decimal strings. */
    private BigInteger gasReimbursed;
    private BigInteger gasPrice;
    private BigInteger gasUsed;
    private String executor;
    /** Contract-reported execution time, distinct from the block timestamp. */
    private Instant executedAt;

    private long totalSwaps;
    private BigDecimal totalVolumeIn;
    private BigDecimal totalVolumeOut;

    private Set<String> appliedRollups = new HashSet<>();

    public enum RebalanceStatus {
        SUCCESS,
        FAILED
    }
}
