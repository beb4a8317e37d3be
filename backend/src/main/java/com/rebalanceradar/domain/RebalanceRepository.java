package com.rebalanceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for rebalances keyed by {chainId}-{txHash}-{logIndex}.
 */
public interface RebalanceRepository extends MongoRepository<Rebalance, String>, RebalanceRepositoryCustom {

    /**
     * Parent lookup for a swap: latest rebalance in the same transaction logged before the swap.
     */
    Optional<Rebalance> findFirstByChainIdAndTxHashAndLogIndexLessThanOrderByLogIndexDesc(
            long chainId, String txHash, long logIndex);

    List<Rebalance> findByStrategyKeyOrderByBlockNumberDescLogIndexDesc(String strategyKey);

    List<Rebalance> findByUserAddressOrderByBlockNumberDesc(String userAddress);

    List<Rebalance> findByChainIdAndUserAddressOrderByBlockNumberDesc(long chainId, String userAddress);
}
