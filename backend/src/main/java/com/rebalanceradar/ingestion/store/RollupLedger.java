package com.rebalanceradar.ingestion.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Applies an aggregate change at most once per (source record, target). The claim is an atomic
 * $addToSet on the source document's appliedRollups; when the change throws, the claim is pulled
 * again so the redelivered event retries it. The claim and the change are two separate writes: a
 * process that dies between them leaves the target claimed but never changed, and that roll-up is
 * not recovered by redelivery.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RollupLedger {

    static final String FIELD = "appliedRollups";

    private final MongoTemplate mongoTemplate;

    /**
     * @return true if the change ran in this call
     */
    public boolean applyOnce(Class<?> sourceType, Object sourceId, String target, Runnable change) {
        // claimed before the change runs; a crash in between loses this roll-up (under-count, never double)
        Query unclaimed = Query.query(where("_id").is(sourceId).and(FIELD).ne(target));
        boolean claimed = mongoTemplate.updateFirst(unclaimed, new Update().addToSet(FIELD, target), sourceType)
                .getModifiedCount() > 0;
        if (!claimed) {
            log.debug("Roll-up {} already applied for {} {}", target, sourceType.getSimpleName(), sourceId);
            return false;
        }
        try {
            change.run();
            return true;
        } catch (RuntimeException e) {
            mongoTemplate.updateFirst(Query.query(where("_id").is(sourceId)), new Update().pull(FIELD, target), sourceType);
            throw e;
        }
    }
}
