package com.rebalanceradar.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;

import static org.springframework.data.mongodb.core.query.Criteria.where;

@Repository
@RequiredArgsConstructor
public class RebalanceRepositoryImpl implements RebalanceRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public void recordSwap(String rebalanceId, BigDecimal amountIn, BigDecimal amountOut) {
        Update update = new Update()
                .inc("totalSwaps", 1)
                .inc("totalVolumeIn", MongoAmounts.decimal(amountIn))
                .inc("totalVolumeOut", MongoAmounts.decimal(amountOut));
        mongoTemplate.updateFirst(Query.query(where("_id").is(rebalanceId)), update, Rebalance.class);
    }
}
