package com.rebalanceradar.ingestion.store;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

/**
 * Create-once insert keyed by the document id. A second insert of the same key is a no-op that
 * hands back the stored (first-seen) document, which tolerates at-least-once delivery from both
 * ingestion paths.
 */
@Service
@RequiredArgsConstructor
public class IdempotentRecordStore {

    private final MongoTemplate mongoTemplate;

    public <T> InsertOutcome<T> insertIfAbsent(T document, Object id, Class<T> type) {
        try {
            return new InsertOutcome<>(true, mongoTemplate.insert(document));
        } catch (DuplicateKeyException e) {
            T existing = mongoTemplate.findById(id, type);
            if (existing == null) {
                // duplicate on a secondary unique index rather than on _id
                throw e;
            }
            return new InsertOutcome<>(false, existing);
        }
    }

    /**
     * @param created true if this call inserted the document
     * @param stored  the document now in the store
     */
    public record InsertOutcome<T>(boolean created, T stored) {
    }
}
