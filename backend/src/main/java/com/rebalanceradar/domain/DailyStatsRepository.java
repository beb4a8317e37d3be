package com.rebalanceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.List;

/**
 * Persistence for daily_stats keyed by {chainId}-{date}.
 */
public interface DailyStatsRepository extends MongoRepository<DailyStats, String>, DailyStatsRepositoryCustom {

    /** Inclusive ISO date range; lexical order of yyyy-MM-dd matches calendar order. */
    @Query(value = "{ 'chainId': ?0, 'date': { '$gte': ?1, '$lte': ?2 } }", sort = "{ 'date': 1 }")
    List<DailyStats> findRange(long chainId, String fromDate, String toDate);
}
