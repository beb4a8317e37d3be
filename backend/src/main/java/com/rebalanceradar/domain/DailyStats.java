package com.rebalanceradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

/**
 * Per-chain daily aggregates. Id = {chainId}-{yyyy-MM-dd}, date taken from the block timestamp in UTC.
 */
@Document(collection = "daily_stats")
@CompoundIndex(name = "chain_date", def = "{'chainId': 1, 'date': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DailyStats {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long chainId;
    /** ISO date, yyyy-MM-dd. */
    private String date;

    private long totalRebalances;
    private long failedRebalances;
    private long totalSwaps;
    private long newStrategies;
    private BigDecimal totalVolume;
    private BigDecimal totalGasSpentWei;
    private double averageDrift;

    private Set<String> activeUsers = new HashSet<>();
    private Set<String> activeStrategies = new HashSet<>();

    public int getUniqueUsers() {
        return activeUsers == null ? 0 : activeUsers.size();
    }

    public int getActiveStrategyCount() {
        return activeStrategies == null ? 0 : activeStrategies.size();
    }

    public static String dateOf(Instant blockTimestamp) {
        return LocalDate.ofInstant(blockTimestamp, ZoneOffset.UTC).toString();
    }

    public static String key(long chainId, String date) {
        return chainId + "-" + date;
    }
}
