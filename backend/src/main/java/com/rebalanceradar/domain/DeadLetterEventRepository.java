package com.rebalanceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface DeadLetterEventRepository extends MongoRepository<DeadLetterEvent, String> {

    List<DeadLetterEvent> findAllByOrderByDeadLetteredAtDesc();

    List<DeadLetterEvent> findByChainIdOrderByDeadLetteredAtDesc(long chainId);
}
