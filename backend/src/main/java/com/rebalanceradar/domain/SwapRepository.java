package com.rebalanceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface SwapRepository extends MongoRepository<Swap, String> {

    List<Swap> findByRebalanceIdOrderBySwapIndexAsc(String rebalanceId);

    List<Swap> findByStrategyKeyOrderByBlockNumberDesc(String strategyKey);
}
