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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Target-allocation strategy owned by a wallet on one chain.
 * Id = {chainId}-{userAddress}-{strategyId}; {@code active=false} is terminal.
 * The *Position fields hold the event position (block * 1e6 + logIndex) of the last applied change of that kind.
 */
@Document(collection = "strategies")
@CompoundIndex(name = "chain_user_strategy", def = "{'chainId': 1, 'userAddress': 1, 'strategyId': 1}", unique = true)
@CompoundIndex(name = "user_chain", def = "{'userAddress': 1, 'chainId': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Strategy {

    public static final long DEFAULT_REBALANCE_INTERVAL_SECONDS = 3600L;

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long chainId;
    private String userAddress;
    private BigInteger strategyId;

    private String name;
    private List<String> tokens = new ArrayList<>();
    /** Basis points, parallel to tokens. */
    private List<Long> weights = new ArrayList<>();
    private long rebalanceInterval = DEFAULT_REBALANCE_INTERVAL_SECONDS;

    private boolean active;
    private boolean paused;
    private Instant lastRebalanceTime;

    private long totalRebalances;
    private long totalSwaps;
    private BigDecimal totalVolume;
    private BigDecimal totalGasSpentWei;
    /** Weighted running mean of drift percentage over successful rebalances (n = totalRebalances). */
    private double averageDrift;

    private long createdPosition;
    private long pausePosition;
    private long allocationPosition;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant deletedAt;

    private Set<String> appliedRollups = new HashSet<>();

    public static String key(long chainId, String userAddress, BigInteger strategyId) {
        return chainId + "-" + userAddress.toLowerCase() + "-" + strategyId;
    }
}
