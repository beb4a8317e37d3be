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
 * Implementation of UserAccountRepositoryCustom using MongoTemplate upserts ($inc, $min, $max).
 */
@Repository
@RequiredArgsConstructor
public class UserAccountRepositoryImpl implements UserAccountRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public void recordStrategyCreated(String userAddress, Instant activityAt) {
        Update update = activity(activityAt).inc("strategyCount", 1);
        mongoTemplate.upsert(byId(userAddress), update, UserAccount.class);
    }

    @Override
    public void recordStrategyDeleted(String userAddress, Instant activityAt) {
        Document set = new Document("strategyCount",
                new Document("$max", List.of(0L,
                        new Document("$subtract", List.of(new Document("$ifNull", List.of("$strategyCount", 0L)), 1L)))))
                .append("lastActivityAt",
                        new Document("$max", List.of("$lastActivityAt", Date.from(activityAt))));
        AggregationOperation stage = context -> new Document("$set", set);
        mongoTemplate.updateFirst(byId(userAddress), AggregationUpdate.from(List.of(stage)), UserAccount.class);
    }

    @Override
    public void recordRebalance(String userAddress, BigDecimal gasSpentWei, Instant activityAt) {
        Update update = activity(activityAt)
                .inc("totalRebalances", 1)
                .inc("totalGasSpentWei", MongoAmounts.decimal(gasSpentWei));
        mongoTemplate.upsert(byId(userAddress), update, UserAccount.class);
    }

    private static Update activity(Instant activityAt) {
        return new Update()
                .min("firstActivityAt", activityAt)
                .max("lastActivityAt", activityAt);
    }

    private static Query byId(String userAddress) {
        return Query.query(where("_id").is(userAddress.toLowerCase()));
    }
}
