package com.rebalanceradar.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

@Repository
@RequiredArgsConstructor
public class ChainIndexStateRepositoryImpl implements ChainIndexStateRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<ChainIndexState> tryAcquireBackfillLease(long chainId, String owner, Instant now, Instant leaseUntil) {
        Query query = Query.query(where("_id").is(chainId).orOperator(
                where("backfillOwner").is(null),
                where("backfillLeaseUntil").lt(now)));
        Update update = new Update()
                .set("backfillOwner", owner)
                .set("backfillLeaseUntil", leaseUntil)
                .set("pauseRequested", false)
                .set("lastError", null)
                .set("updatedAt", now);
        try {
            return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                    FindAndModifyOptions.options().upsert(true).returnNew(true), ChainIndexState.class));
        } catch (DuplicateKeyException e) {
            // document exists and the lease is held: the upsert tried to insert a second _id
            return Optional.empty();
        }
    }

    @Override
    public void recordBackfillTarget(long chainId, String owner, long targetBlock) {
        Update update = new Update()
                .set("backfillTargetBlock", targetBlock)
                .set("updatedAt", Instant.now());
        mongoTemplate.updateFirst(ownedBy(chainId, owner), update, ChainIndexState.class);
    }

    @Override
    public Optional<ChainIndexState> recordBackfillBatch(long chainId, String owner, long lastBlock, Instant leaseUntil) {
        Update update = new Update()
                .max("latestIndexedBlock", lastBlock)
                .set("backfillLeaseUntil", leaseUntil)
                .set("updatedAt", Instant.now());
        return Optional.ofNullable(mongoTemplate.findAndModify(ownedBy(chainId, owner), update,
                FindAndModifyOptions.options().returnNew(true), ChainIndexState.class));
    }

    @Override
    public void releaseBackfillLease(long chainId, String owner, String lastError) {
        Update update = new Update()
                .unset("backfillOwner")
                .unset("backfillLeaseUntil")
                .set("pauseRequested", false)
                .set("lastError", lastError)
                .set("updatedAt", Instant.now());
        mongoTemplate.updateFirst(ownedBy(chainId, owner), update, ChainIndexState.class);
    }

    @Override
    public long requestPauseAll() {
        Query query = Query.query(where("backfillOwner").ne(null));
        return mongoTemplate.updateMulti(query, Update.update("pauseRequested", true), ChainIndexState.class)
                .getModifiedCount();
    }

    @Override
    public boolean requestPause(long chainId) {
        Query query = Query.query(where("_id").is(chainId).and("backfillOwner").ne(null));
        return mongoTemplate.updateFirst(query, Update.update("pauseRequested", true), ChainIndexState.class)
                .getMatchedCount() > 0;
    }

    @Override
    public void recordLiveBlock(long chainId, long block) {
        Update update = new Update()
                .max("liveBlock", block)
                .set("updatedAt", Instant.now());
        mongoTemplate.upsert(Query.query(where("_id").is(chainId)), update, ChainIndexState.class);
    }

    private static Query ownedBy(long chainId, String owner) {
        return Query.query(Criteria.where("_id").is(chainId).and("backfillOwner").is(owner));
    }
}
