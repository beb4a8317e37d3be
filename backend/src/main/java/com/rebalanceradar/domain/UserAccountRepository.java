package com.rebalanceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for users keyed by lowercased wallet address.
 */
public interface UserAccountRepository extends MongoRepository<UserAccount, String>, UserAccountRepositoryCustom {
}
