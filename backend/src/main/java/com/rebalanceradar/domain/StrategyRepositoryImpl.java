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
import java.time.Instant;
import java.util.Date;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of StrategyRepositoryCustom using MongoTemplate. Every method is one keyed update.
 */
@Repository
@RequiredArgsConstructor
public class StrategyRepositoryImpl implements StrategyRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean applyPauseState(String strategyKey, boolean paused, long position, Instant blockTimestamp) {
        Query query = Query.query(where("_id").is(strategyKey)
                .and("active").is(true)
                .and("pausePosition").lt(position));
        Update update = new Update()
                .set("paused", paused)
                .set("pausePosition", position)
                .max("updatedAt", blockTimestamp);
        return mongoTemplate.updateFirst(query, update, Strategy.class).getModifiedCount() > 0;
    }

    @Override
    public boolean applyAllocation(String strategyKey, List<String> tokens, List<Long> weights,
                                   long position, Instant blockTimestamp) {
        Query query = Query.query(where("_id").is(strategyKey)
                .and("active").is(true)
                .and("allocationPosition").lt(position));
        Update update = new Update()
                .set("tokens", tokens)
                .set("weights", weights)
                .set("allocationPosition", position)
                .max("updatedAt", blockTimestamp);
        return mongoTemplate.updateFirst(query, update, Strategy.class).getModifiedCount() > 0;
    }

    @Override
    public boolean markDeleted(String strategyKey, Instant blockTimestamp) {
        Query query = Query.query(where("_id").is(strategyKey).and("active").is(true));
        Update update = new Update()
                .set("active", false)
                .set("deletedAt", blockTimestamp)
                .max("updatedAt", blockTimestamp);
        return mongoTemplate.updateFirst(query, update, Strategy.class).getModifiedCount() > 0;
    }

    @Override
    public boolean advanceLastRebalanceTime(String strategyKey, Instant lastRebalanceTime, Instant blockTimestamp) {
        Query query = Query.query(where("_id").is(strategyKey));
        Update update = new Update()
                .max("lastRebalanceTime", lastRebalanceTime)
                .max("updatedAt", blockTimestamp);
        return mongoTemplate.updateFirst(query, update, Strategy.class).getModifiedCount() > 0;
    }

    @Override
    public void recordRebalance(String strategyKey, double driftPercentage, BigDecimal gasSpentWei,
                                Instant executedAt, Instant blockTimestamp) {
        Document set = RunningMean.fold("averageDrift", "totalRebalances", driftPercentage)
                .append("totalGasSpentWei", new Document("$add", List.of(
                        new Document("$ifNull", List.of("$totalGasSpentWei", MongoAmounts.ZERO)),
                        MongoAmounts.decimal(gasSpentWei))))
                .append("lastRebalanceTime", new Document("$max", List.of("$lastRebalanceTime", Date.from(executedAt))))
                .append("updatedAt", new Document("$max", List.of("$updatedAt", Date.from(blockTimestamp))));
        AggregationOperation stage = context -> new Document("$set", set);
        mongoTemplate.updateFirst(Query.query(where("_id").is(strategyKey)),
                AggregationUpdate.from(List.of(stage)), Strategy.class);
    }

    @Override
    public void recordSwap(String strategyKey, BigDecimal volume) {
        Update update = new Update()
                .inc("totalSwaps", 1)
                .inc("totalVolume", MongoAmounts.decimal(volume));
        mongoTemplate.updateFirst(Query.query(where("_id").is(strategyKey)), update, Strategy.class);
    }
}
