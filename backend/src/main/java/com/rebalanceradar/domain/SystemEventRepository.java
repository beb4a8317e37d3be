package com.rebalanceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface SystemEventRepository extends MongoRepository<SystemEvent, String> {

    List<SystemEvent> findByChainIdOrderByBlockNumberDescLogIndexDesc(long chainId);

    List<SystemEvent> findByChainIdAndTypeOrderByBlockNumberDesc(long chainId, SystemEvent.SystemEventType type);
}
