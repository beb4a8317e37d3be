package com.rebalanceradar.ingestion.queue;

import com.rebalanceradar.common.RetryPolicy;
import com.rebalanceradar.domain.DeadLetterEvent;
import com.rebalanceradar.domain.DeadLetterEventRepository;
import com.rebalanceradar.domain.QueuedEvent;
import com.rebalanceradar.domain.QueuedEvent.QueueStatus;
import com.rebalanceradar.domain.QueuedEventRepository;
import com.rebalanceradar.ingestion.config.IngestionQueueProperties;
import com.rebalanceradar.ingestion.event.RawChainEvent;
import com.rebalanceradar.notification.ChangeNotifier;
import com.rebalanceradar.notification.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Durable, partitioned, at-least-once queue between the chain readers and the reducer, stored in
 * {@code ingestion_queue}. An item is owned by its consumer from claim until it is completed,
 * rescheduled or dead-lettered; every transition is conditional on that claim. Items sharing a
 * routing key are handed out strictly one after another: while one is in flight or waiting out a
 * retry delay, the rest of its route waits too.
 */
@Slf4j
@Component
public class IngestionQueue {

    static final String SYSTEM_ROUTE = "system";
    private static final int MAX_ERROR_LENGTH = 1000;

    private final MongoTemplate mongoTemplate;
    private final QueuedEventRepository queuedEventRepository;
    private final DeadLetterEventRepository deadLetterEventRepository;
    private final IngestionQueueProperties properties;
    private final ChangeNotifier changeNotifier;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public IngestionQueue(MongoTemplate mongoTemplate, QueuedEventRepository queuedEventRepository,
                          DeadLetterEventRepository deadLetterEventRepository, IngestionQueueProperties properties,
                          ChangeNotifier changeNotifier) {
        this(mongoTemplate, queuedEventRepository, deadLetterEventRepository, properties, changeNotifier, Clock.systemUTC());
    }

    IngestionQueue(MongoTemplate mongoTemplate, QueuedEventRepository queuedEventRepository,
                   DeadLetterEventRepository deadLetterEventRepository, IngestionQueueProperties properties,
                   ChangeNotifier changeNotifier, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.queuedEventRepository = queuedEventRepository;
        this.deadLetterEventRepository = deadLetterEventRepository;
        this.properties = properties;
        this.changeNotifier = changeNotifier;
        this.clock = clock;
        this.retryPolicy = new RetryPolicy(properties.getBaseDelayMs(), properties.getMaxDelayMs(),
                properties.getJitterFactor(), Math.max(1, properties.getMaxAttempts()));
    }

    /**
     * Adds the event unless an item with the same key is already queued (pending, in flight or done
     * within the retention window) or dead-lettered.
     *
     * @return true if a new item was stored
     */
    public boolean enqueue(RawChainEvent event) {
        String id = event.eventKey();
        if (deadLetterEventRepository.existsById(id)) {
            log.debug("Not enqueueing {}: dead-lettered, replay it explicitly", id);
            return false;
        }
        try {
            mongoTemplate.insert(toQueuedEvent(event, clock.instant()));
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Already queued: {}", id);
            return false;
        }
    }

    /**
     * Claims the oldest ready item of the partition, by block number then log index, skipping
     * routes that are blocked by an earlier item.
     */
    public Optional<QueuedEvent> claimNext(int partition) {
        Instant now = clock.instant();
        Criteria ready = where("partition").is(partition)
                .and("status").is(QueueStatus.PENDING)
                .and("nextAttemptAt").lte(now);
        List<String> blocked = blockedRoutes(partition, now);
        if (!blocked.isEmpty()) {
            ready = ready.and("routingKey").nin(blocked);
        }
        Query query = Query.query(ready)
                .with(Sort.by(Sort.Direction.ASC, "blockNumber", "logIndex"));
        Update update = new Update()
                .set("status", QueueStatus.PROCESSING)
                .set("claimedAt", now)
                .inc("attempts", 1);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), QueuedEvent.class));
    }

    /** Routes with an item in flight or backing off after a failure. */
    List<String> blockedRoutes(int partition, Instant now) {
        Query query = Query.query(where("partition").is(partition).orOperator(
                where("status").is(QueueStatus.PROCESSING),
                where("status").is(QueueStatus.PENDING).and("nextAttemptAt").gt(now)));
        return mongoTemplate.findDistinct(query, "routingKey", QueuedEvent.class, String.class);
    }

    public void complete(QueuedEvent item) {
        Update update = new Update()
                .set("status", QueueStatus.DONE)
                .set("completedAt", clock.instant())
                .unset("claimedAt")
                .unset("lastError");
        if (mongoTemplate.updateFirst(claimed(item), update, QueuedEvent.class).getMatchedCount() == 0) {
            log.warn("Lost claim on {} before completion; it will be processed again", item.getId());
        }
    }

    /**
     * Reschedules the item with backoff, or dead-letters it once the attempt budget is spent or the
     * failure is not retryable.
     */
    public void fail(QueuedEvent item, Exception error, boolean retryable) {
        String message = describe(error);
        if (!retryable || item.getAttempts() >= retryPolicy.getMaxAttempts()) {
            deadLetter(item, message, retryable);
            return;
        }
        long delayMs = retryPolicy.delayMs(item.getAttempts() - 1);
        Update update = new Update()
                .set("status", QueueStatus.PENDING)
                .set("nextAttemptAt", clock.instant().plusMillis(delayMs))
                .set("lastError", message)
                .unset("claimedAt");
        mongoTemplate.updateFirst(claimed(item), update, QueuedEvent.class);
        log.warn("{} {} failed (attempt {}/{}), retry in {} ms: {}", item.getEventName(), item.getId(),
                item.getAttempts(), retryPolicy.getMaxAttempts(), delayMs, message);
    }

    void deadLetter(QueuedEvent item, String message, boolean retryable) {
        Instant now = clock.instant();
        DeadLetterEvent dead = new DeadLetterEvent();
        dead.setId(item.getId());
        dead.setChainId(item.getChainId());
        dead.setEventName(item.getEventName());
        dead.setBlockNumber(item.getBlockNumber());
        dead.setBlockTimestamp(item.getBlockTimestamp());
        dead.setTransactionHash(item.getTransactionHash());
        dead.setLogIndex(item.getLogIndex());
        dead.setData(item.getData());
        dead.setAttempts(item.getAttempts());
        dead.setLastError(message);
        dead.setRetryable(retryable);
        dead.setDeadLetteredAt(now);
        deadLetterEventRepository.save(dead);
        mongoTemplate.remove(claimed(item), QueuedEvent.class);
        log.warn("Dead-lettered {} {} after {} attempt(s): {}", item.getEventName(), item.getId(), item.getAttempts(), message);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", "dead_letter");
        fields.put("eventKey", item.getId());
        fields.put("eventName", item.getEventName());
        fields.put("chainId", item.getChainId());
        fields.put("error", message);
        changeNotifier.publish(NotificationChannel.SYSTEM_ALERT, fields);
    }

    /**
     * Returns claims older than staleAfterMs to PENDING; their consumer is presumed dead.
     *
     * @return items released
     */
    public long recoverStaleClaims() {
        Instant now = clock.instant();
        Query query = Query.query(where("status").is(QueueStatus.PROCESSING)
                .and("claimedAt").lt(now.minusMillis(properties.getStaleAfterMs())));
        Update update = new Update()
                .set("status", QueueStatus.PENDING)
                .set("nextAttemptAt", now)
                .unset("claimedAt");
        long released = mongoTemplate.updateMulti(query, update, QueuedEvent.class).getModifiedCount();
        if (released > 0) {
            log.warn("Released {} stale queue claim(s)", released);
        }
        return released;
    }

    /**
     * Moves a dead-lettered event back into the queue with a fresh attempt budget.
     *
     * @return false if no dead letter has that id
     */
    public boolean replayDeadLetter(String id) {
        Optional<DeadLetterEvent> found = deadLetterEventRepository.findById(id);
        if (found.isEmpty()) {
            return false;
        }
        DeadLetterEvent dead = found.get();
        RawChainEvent event = new RawChainEvent(dead.getChainId(), dead.getEventName(), dead.getBlockNumber(),
                dead.getBlockTimestamp(), dead.getTransactionHash(), dead.getLogIndex(), dead.getData());
        // a DONE item with the same key would swallow the insert
        mongoTemplate.remove(Query.query(where("_id").is(id)), QueuedEvent.class);
        mongoTemplate.insert(toQueuedEvent(event, clock.instant()));
        deadLetterEventRepository.deleteById(id);
        log.info("Replaying dead-lettered {} {}", dead.getEventName(), id);
        return true;
    }

    public QueueStats stats() {
        return new QueueStats(
                queuedEventRepository.countByStatus(QueueStatus.PENDING),
                queuedEventRepository.countByStatus(QueueStatus.PROCESSING),
                queuedEventRepository.countByStatus(QueueStatus.DONE),
                deadLetterEventRepository.count());
    }

    public int partitions() {
        return Math.max(1, properties.getPartitions());
    }

    /** {chainId}:{user} for user-scoped events, {chainId}:system otherwise. */
    static String routingKey(RawChainEvent event) {
        Object user = event.data().get("user");
        String owner = user != null ? user.toString().toLowerCase(Locale.ROOT) : SYSTEM_ROUTE;
        return event.chainId() + ":" + owner;
    }

    static int partitionOf(String routingKey, int partitions) {
        return Math.floorMod(routingKey.hashCode(), partitions);
    }

    static RawChainEvent toRawEvent(QueuedEvent item) {
        return new RawChainEvent(item.getChainId(), item.getEventName(), item.getBlockNumber(), item.getBlockTimestamp(),
                item.getTransactionHash(), item.getLogIndex(), item.getData());
    }

    private QueuedEvent toQueuedEvent(RawChainEvent event, Instant now) {
        String routingKey = routingKey(event);
        QueuedEvent item = new QueuedEvent();
        item.setId(event.eventKey());
        item.setChainId(event.chainId());
        item.setEventName(event.eventName());
        item.setBlockNumber(event.blockNumber());
        item.setBlockTimestamp(event.blockTimestamp());
        item.setTransactionHash(event.transactionHash());
        item.setLogIndex(event.logIndex());
        item.setData(new LinkedHashMap<>(event.data()));
        item.setRoutingKey(routingKey);
        item.setPartition(partitionOf(routingKey, partitions()));
        item.setStatus(QueueStatus.PENDING);
        item.setAttempts(0);
        item.setNextAttemptAt(now);
        item.setEnqueuedAt(now);
        return item;
    }

    /** Matches the item only while this claim (status and attempt number) still holds. */
    private static Query claimed(QueuedEvent item) {
        return Query.query(where("_id").is(item.getId())
                .and("status").is(QueueStatus.PROCESSING)
                .and("attempts").is(item.getAttempts()));
    }

    private static String describe(Exception error) {
        String message = error.getClass().getSimpleName() + ": " + error.getMessage();
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
