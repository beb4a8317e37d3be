package com.rebalanceradar.domain;

import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.aggregation.AggregationUpdate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of DailyStatsRepositoryCustom. Counter-only changes use a plain $inc upsert;
 * the drift mean needs a pipeline upsert so mean and count move together.
 */
@Repository
@RequiredArgsConstructor
public class DailyStatsRepositoryImpl implements DailyStatsRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public void recordStrategyCreated(long chainId, String date, String userAddress, String strategyKey) {
        Update update = onInsert(chainId, date)
                .inc("newStrategies", 1)
                .addToSet("activeUsers", userAddress)
                .addToSet("activeStrategies", strategyKey);
        mongoTemplate.upsert(byKey(chainId, date), update, DailyStats.class);
    }

    @Override
    public void recordRebalance(long chainId, String date, double driftPercentage, BigDecimal gasSpentWei,
                                String userAddress, String strategyKey) {
        Document set = RunningMean.fold("averageDrift", "totalRebalances", driftPercentage)
                .append("chainId", chainId)
                .append("date", date)
                .append("totalGasSpentWei", new Document("$add", List.of(
                        new Document("$ifNull", List.of("$totalGasSpentWei", MongoAmounts.ZERO)),
                        MongoAmounts.decimal(gasSpentWei))))
                .append("activeUsers", union("activeUsers", userAddress))
                .append("activeStrategies", union("activeStrategies", strategyKey));
        AggregationOperation stage = context -> new Document("$set", set);
        mongoTemplate.upsert(byKey(chainId, date), AggregationUpdate.from(List.of(stage)), DailyStats.class);
    }

    @Override
    public void recordRebalanceFailed(long chainId, String date, String userAddress, String strategyKey) {
        Update update = onInsert(chainId, date)
                .inc("failedRebalances", 1)
                .addToSet("activeUsers", userAddress)
                .addToSet("activeStrategies", strategyKey);
        mongoTemplate.upsert(byKey(chainId, date), update, DailyStats.class);
    }

    @Override
    public void recordSwap(long chainId, String date, BigDecimal volume) {
        Update update = onInsert(chainId, date)
                .inc("totalSwaps", 1)
                .inc("totalVolume", MongoAmounts.decimal(volume));
        mongoTemplate.upsert(byKey(chainId, date), update, DailyStats.class);
    }

    private static Document union(String field, String value) {
        return new Document("$setUnion", List.of(new Document("$ifNull", List.of("$" + field, List.of())), List.of(value)));
    }

    private static Update onInsert(long chainId, String date) {
        return new Update()
                .setOnInsert("chainId", chainId)
                .setOnInsert("date", date);
    }

    private static Query byKey(long chainId, String date) {
        return Query.query(where("_id").is(DailyStats.key(chainId, date)));
    }
}
