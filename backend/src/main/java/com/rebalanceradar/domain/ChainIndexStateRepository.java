package com.rebalanceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for chain_index_state keyed by chain id.
 */
public interface ChainIndexStateRepository extends MongoRepository<ChainIndexState, Long>, ChainIndexStateRepositoryCustom {
}
