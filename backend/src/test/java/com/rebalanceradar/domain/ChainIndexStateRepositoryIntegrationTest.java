package com.rebalanceradar.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "rebalanceradar.ingestion.backfill.auto-resume-on-startup=false",
        "rebalanceradar.ingestion.live.enabled=false",
        "rebalanceradar.ingestion.queue.consumers-enabled=false"
})
@Testcontainers(disabledWithoutDocker = true)
class ChainIndexStateRepositoryIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    private static final long CHAIN = SupportedChain.BASE_SEPOLIA.chainId();

    @Autowired
    ChainIndexStateRepository repository;

    @BeforeEach
    void clean() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("only one owner holds the backfill lease until it expires")
    void lease_isExclusiveUntilExpiry() {
        Instant now = Instant.now();

        assertThat(repository.tryAcquireBackfillLease(CHAIN, "scanner-a", now, now.plusSeconds(60))).isPresent();
        assertThat(repository.tryAcquireBackfillLease(CHAIN, "scanner-b", now, now.plusSeconds(60))).isEmpty();

        Instant later = now.plusSeconds(120);
        assertThat(repository.tryAcquireBackfillLease(CHAIN, "scanner-b", later, later.plusSeconds(60)))
                .map(ChainIndexState::getBackfillOwner).contains("scanner-b");
    }

    @Test
    @DisplayName("a lease left behind by a crashed scanner is taken over with its progress once expired")
    void staleLease_isTakenOverWithProgress() {
        Instant crashedAt = Instant.now().minusSeconds(600);
        ChainIndexState orphaned = new ChainIndexState();
        orphaned.setId(CHAIN);
        orphaned.setLatestIndexedBlock(700L);
        orphaned.setBackfillOwner("crashed-scanner");
        orphaned.setBackfillLeaseUntil(crashedAt.plusSeconds(300));
        repository.save(orphaned);

        Instant now = Instant.now();
        ChainIndexState taken = repository.tryAcquireBackfillLease(CHAIN, "restarted", now, now.plusSeconds(300))
                .orElseThrow();

        assertThat(taken.getBackfillOwner()).isEqualTo("restarted");
        assertThat(taken.getLatestIndexedBlock()).isEqualTo(700L);
        assertThat(repository.recordBackfillBatch(CHAIN, "crashed-scanner", 9_000, now.plusSeconds(60))).isEmpty();
    }

    @Test
    @DisplayName("progress never moves backwards and a former owner cannot move it")
    void batchProgress_isMonotonicAndFenced() {
        Instant now = Instant.now();
        repository.tryAcquireBackfillLease(CHAIN, "scanner-a", now, now.plusSeconds(60));

        assertThat(repository.recordBackfillBatch(CHAIN, "scanner-a", 2_000, now.plusSeconds(60)))
                .map(ChainIndexState::getLatestIndexedBlock).contains(2_000L);
        assertThat(repository.recordBackfillBatch(CHAIN, "scanner-a", 1_500, now.plusSeconds(60)))
                .map(ChainIndexState::getLatestIndexedBlock).contains(2_000L);
        assertThat(repository.recordBackfillBatch(CHAIN, "scanner-b", 9_000, now.plusSeconds(60))).isEmpty();

        repository.releaseBackfillLease(CHAIN, "scanner-a", null);
        ChainIndexState released = repository.findById(CHAIN).orElseThrow();
        assertThat(released.getBackfillOwner()).isNull();
        assertThat(released.getLatestIndexedBlock()).isEqualTo(2_000L);
    }

    @Test
    @DisplayName("pause requests only flag chains with a running backfill and are cleared by the next acquire")
    void pauseRequest_flagsRunningScanOnly() {
        assertThat(repository.requestPause(CHAIN)).isFalse();

        Instant now = Instant.now();
        repository.tryAcquireBackfillLease(CHAIN, "scanner-a", now, now.plusSeconds(60));
        assertThat(repository.requestPauseAll()).isEqualTo(1);
        assertThat(repository.findById(CHAIN)).map(ChainIndexState::isPauseRequested).contains(true);

        repository.releaseBackfillLease(CHAIN, "scanner-a", null);
        assertThat(repository.tryAcquireBackfillLease(CHAIN, "scanner-b", now, now.plusSeconds(60)))
                .map(ChainIndexState::isPauseRequested).contains(false);
    }

    @Test
    @DisplayName("the live cursor is independent of backfill progress")
    void liveBlock_tracksSeparately() {
        repository.recordLiveBlock(CHAIN, 5_000);
        repository.recordLiveBlock(CHAIN, 4_000);

        ChainIndexState state = repository.findById(CHAIN).orElseThrow();
        assertThat(state.getLiveBlock()).isEqualTo(5_000L);
        assertThat(state.getLatestIndexedBlock()).isNull();
    }
}
