package com.rebalanceradar.ingestion.queue;

import com.rebalanceradar.domain.DeadLetterEvent;
import com.rebalanceradar.domain.DeadLetterEventRepository;
import com.rebalanceradar.domain.QueuedEvent;
import com.rebalanceradar.domain.QueuedEvent.QueueStatus;
import com.rebalanceradar.domain.QueuedEventRepository;
import com.rebalanceradar.ingestion.event.RawChainEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.data.mongodb.core.query.Criteria.where;

@SpringBootTest(properties = {
        "rebalanceradar.ingestion.backfill.auto-resume-on-startup=false",
        "rebalanceradar.ingestion.live.enabled=false",
        "rebalanceradar.ingestion.queue.consumers-enabled=false",
        "rebalanceradar.ingestion.queue.partitions=1",
        "rebalanceradar.ingestion.queue.max-attempts=2",
        "rebalanceradar.ingestion.queue.base-delay-ms=0",
        "rebalanceradar.ingestion.queue.max-delay-ms=0",
        "rebalanceradar.ingestion.queue.jitter-factor=0"
})
@Testcontainers(disabledWithoutDocker = true)
class IngestionQueueIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    private static final Instant BLOCK_TIME = Instant.parse("2025-03-01T00:00:00Z");

    @Autowired
    IngestionQueue queue;
    @Autowired
    QueuedEventRepository queuedEventRepository;
    @Autowired
    DeadLetterEventRepository deadLetterEventRepository;
    @Autowired
    MongoTemplate mongoTemplate;

    @BeforeEach
    void clean() {
        queuedEventRepository.deleteAll();
        deadLetterEventRepository.deleteAll();
    }

    @Test
    @DisplayName("items are claimed in block then log order")
    void claim_followsChainOrder() {
        queue.enqueue(event("0xc", 12, 0));
        queue.enqueue(event("0xb", 10, 5));
        queue.enqueue(event("0xa", 10, 2));

        assertThat(claimAndComplete()).isEqualTo("10143-0xa-2");
        assertThat(claimAndComplete()).isEqualTo("10143-0xb-5");
        assertThat(claimAndComplete()).isEqualTo("10143-0xc-0");
        assertThat(queue.claimNext(0)).isEmpty();
    }

    @Test
    @DisplayName("an item in flight holds back the rest of its route but not other routes")
    void claim_inFlightItemBlocksOnlyItsRoute() {
        queue.enqueue(event("0xa", 10, 2));
        queue.enqueue(event("0xa", 10, 3));
        queue.enqueue(eventFor("0xother", "SwapExecuted", "0xb", 11, 0));

        QueuedEvent first = queue.claimNext(0).orElseThrow();
        assertThat(first.getId()).isEqualTo("10143-0xa-2");
        assertThat(queue.claimNext(0)).map(QueuedEvent::getId).contains("10143-0xb-0");
        assertThat(queue.claimNext(0)).isEmpty();

        queue.complete(first);
        assertThat(queue.claimNext(0)).map(QueuedEvent::getId).contains("10143-0xa-3");
    }

    @Test
    @DisplayName("a swap waits while the rebalance before it in the same transaction backs off")
    void claim_retryingRebalanceHoldsBackItsSwap() {
        queue.enqueue(eventFor("0xuser", "RebalanceExecuted", "0xtx", 20, 4));
        queue.enqueue(eventFor("0xuser", "SwapExecuted", "0xtx", 20, 6));

        QueuedEvent rebalance = queue.claimNext(0).orElseThrow();
        assertThat(rebalance.getEventName()).isEqualTo("RebalanceExecuted");
        queue.fail(rebalance, new IllegalStateException("connection reset"), true);
        mongoTemplate.updateFirst(Query.query(where("_id").is(rebalance.getId())),
                Update.update("nextAttemptAt", Instant.now().plusSeconds(60)), QueuedEvent.class);

        assertThat(queue.claimNext(0)).isEmpty();

        mongoTemplate.updateFirst(Query.query(where("_id").is(rebalance.getId())),
                Update.update("nextAttemptAt", Instant.now().minusSeconds(1)), QueuedEvent.class);
        QueuedEvent retried = queue.claimNext(0).orElseThrow();
        assertThat(retried.getId()).isEqualTo("10143-0xtx-4");
        assertThat(retried.getAttempts()).isEqualTo(2);
        queue.complete(retried);

        assertThat(queue.claimNext(0)).map(QueuedEvent::getEventName).contains("SwapExecuted");
    }

    @Test
    @DisplayName("a log seen by both readers is queued once, also after completion")
    void enqueue_deduplicatesByEventKey() {
        assertThat(queue.enqueue(event("0xa", 10, 2))).isTrue();
        assertThat(queue.enqueue(event("0xA", 10, 2))).isFalse();

        QueuedEvent claimed = queue.claimNext(0).orElseThrow();
        queue.complete(claimed);

        assertThat(queue.enqueue(event("0xa", 10, 2))).isFalse();
        assertThat(queue.stats()).isEqualTo(new QueueStats(0, 0, 1, 0));
    }

    @Test
    @DisplayName("retryable failures are redelivered until the attempt budget is spent, then dead-lettered")
    void fail_retriesThenDeadLetters() {
        queue.enqueue(event("0xa", 10, 2));

        QueuedEvent first = queue.claimNext(0).orElseThrow();
        queue.fail(first, new IllegalStateException("strategy not indexed"), true);
        QueuedEvent pending = queuedEventRepository.findById(first.getId()).orElseThrow();
        assertThat(pending.getStatus()).isEqualTo(QueueStatus.PENDING);
        assertThat(pending.getLastError()).contains("strategy not indexed");

        QueuedEvent second = queue.claimNext(0).orElseThrow();
        assertThat(second.getAttempts()).isEqualTo(2);
        queue.fail(second, new IllegalStateException("still not indexed"), true);

        assertThat(queuedEventRepository.findById(first.getId())).isEmpty();
        DeadLetterEvent dead = deadLetterEventRepository.findById(first.getId()).orElseThrow();
        assertThat(dead.getAttempts()).isEqualTo(2);
        assertThat(dead.isRetryable()).isTrue();
        assertThat(dead.getData()).containsEntry("user", "0xuser");

        assertThat(queue.enqueue(event("0xa", 10, 2))).isFalse();
    }

    @Test
    @DisplayName("a non-retryable failure dead-letters on the first attempt")
    void fail_nonRetryable_deadLettersImmediately() {
        queue.enqueue(event("0xa", 10, 2));

        queue.fail(queue.claimNext(0).orElseThrow(), new IllegalArgumentException("bad payload"), false);

        assertThat(deadLetterEventRepository.findById("10143-0xa-2")).hasValueSatisfying(d -> {
            assertThat(d.isRetryable()).isFalse();
            assertThat(d.getLastError()).startsWith("IllegalArgumentException: bad payload");
        });
    }

    @Test
    @DisplayName("replay moves a dead letter back to the queue with a fresh budget")
    void replay_requeuesDeadLetter() {
        queue.enqueue(event("0xa", 10, 2));
        queue.fail(queue.claimNext(0).orElseThrow(), new IllegalArgumentException("bad payload"), false);

        assertThat(queue.replayDeadLetter("10143-0xa-2")).isTrue();
        assertThat(queue.replayDeadLetter("10143-0xa-2")).isFalse();

        QueuedEvent replayed = queue.claimNext(0).orElseThrow();
        assertThat(replayed.getAttempts()).isEqualTo(1);
        assertThat(replayed.getEventName()).isEqualTo("StrategyPaused");
        assertThat(deadLetterEventRepository.count()).isZero();
    }

    @Test
    @DisplayName("claims held past the stale window are released, and the old claim can no longer complete")
    void staleClaim_isReleasedAndOldOwnerFenced() {
        queue.enqueue(event("0xa", 10, 2));
        QueuedEvent abandoned = queue.claimNext(0).orElseThrow();
        mongoTemplate.updateFirst(Query.query(where("_id").is(abandoned.getId())),
                Update.update("claimedAt", Instant.now().minusSeconds(3600)), QueuedEvent.class);

        assertThat(queue.recoverStaleClaims()).isEqualTo(1);
        QueuedEvent reclaimed = queue.claimNext(0).orElseThrow();
        assertThat(reclaimed.getAttempts()).isEqualTo(2);

        queue.complete(abandoned);
        assertThat(queuedEventRepository.findById(abandoned.getId()))
                .map(QueuedEvent::getStatus).contains(QueueStatus.PROCESSING);

        queue.complete(reclaimed);
        assertThat(queuedEventRepository.findById(abandoned.getId()))
                .map(QueuedEvent::getStatus).contains(QueueStatus.DONE);
    }

    private String claimAndComplete() {
        QueuedEvent item = queue.claimNext(0).orElseThrow();
        queue.complete(item);
        return item.getId();
    }

    private static RawChainEvent eventFor(String user, String eventName, String txHash, long block, long logIndex) {
        return new RawChainEvent(10143L, eventName, block, BLOCK_TIME, txHash, logIndex,
                Map.of("user", user, "strategyId", "1"));
    }

    private static RawChainEvent event(String txHash, long block, long logIndex) {
        return new RawChainEvent(10143L, "StrategyPaused", block, BLOCK_TIME, txHash, logIndex,
                Map.of("user", "0xuser", "strategyId", "1"));
    }
}
