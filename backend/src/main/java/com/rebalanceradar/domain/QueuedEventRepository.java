package com.rebalanceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Read access to the ingestion queue. Claims and transitions go through MongoTemplate in IngestionQueue.
 */
public interface QueuedEventRepository extends MongoRepository<QueuedEvent, String> {

    long countByStatus(QueuedEvent.QueueStatus status);
}
