package com.rebalanceradar.domain;

import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StrategyRepositoryImplTest {

    private static final String KEY = "10143-0x1111111111111111111111111111111111111111-1";
    private static final Instant BLOCK_TIME = Instant.parse("2025-03-02T12:00:00Z");

    @Mock
    private MongoTemplate mongoTemplate;

    private StrategyRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        repository = new StrategyRepositoryImpl(mongoTemplate);
    }

    @Test
    void applyPauseState_onlyMatchesActiveStrategyWithOlderPauseState() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(Strategy.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        boolean changed = repository.applyPauseState(KEY, true, 300_000_004L, BLOCK_TIME);

        assertThat(changed).isTrue();
        Document filter = capturedQuery().getQueryObject();
        assertThat(filter.get("_id")).isEqualTo(KEY);
        assertThat(filter.get("active")).isEqualTo(true);
        assertThat(filter.get("pausePosition")).isEqualTo(new Document("$lt", 300_000_004L));
    }

    @Test
    void applyPauseState_guardDidNotMatch_reportsNoChange() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(Strategy.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(repository.applyPauseState(KEY, false, 300_000_004L, BLOCK_TIME)).isFalse();
    }

    @Test
    void applyAllocation_onlyMatchesActiveStrategyWithOlderAllocation() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(Strategy.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        repository.applyAllocation(KEY, List.of("0xa"), List.of(10_000L), 520_000_003L, BLOCK_TIME);

        Document filter = capturedQuery().getQueryObject();
        assertThat(filter.get("active")).isEqualTo(true);
        assertThat(filter.get("allocationPosition")).isEqualTo(new Document("$lt", 520_000_003L));
    }

    @Test
    void markDeleted_onlyMatchesActiveStrategy() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(Strategy.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(repository.markDeleted(KEY, BLOCK_TIME)).isFalse();
        assertThat(capturedQuery().getQueryObject().get("active")).isEqualTo(true);
    }

    private Query capturedQuery() {
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).updateFirst(query.capture(), any(Update.class), eq(Strategy.class));
        return query.getValue();
    }
}
