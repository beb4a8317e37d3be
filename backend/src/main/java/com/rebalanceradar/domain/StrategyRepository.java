package com.rebalanceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for strategies keyed by {chainId}-{userAddress}-{strategyId}.
 */
public interface StrategyRepository extends MongoRepository<Strategy, String>, StrategyRepositoryCustom {

    Optional<Strategy> findByChainIdAndUserAddressAndStrategyId(long chainId, String userAddress, BigInteger strategyId);

    List<Strategy> findByUserAddressOrderByCreatedAtDesc(String userAddress);

    List<Strategy> findByChainIdOrderByCreatedAtDesc(long chainId);

    List<Strategy> findByChainIdAndUserAddressOrderByCreatedAtDesc(long chainId, String userAddress);
}
