package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.DailyStats;
import com.rebalanceradar.domain.DailyStatsRepository;
import com.rebalanceradar.domain.Strategy;
import com.rebalanceradar.domain.UserAccountRepository;
import com.rebalanceradar.ingestion.event.ChainEvent.StrategyCreated;
import com.rebalanceradar.ingestion.event.EventKind;
import com.rebalanceradar.ingestion.event.EventMeta;
import com.rebalanceradar.ingestion.reducer.ChainEventHandler;
import com.rebalanceradar.ingestion.store.IdempotentRecordStore;
import com.rebalanceradar.ingestion.store.RollupLedger;
import com.rebalanceradar.notification.ChangeNotifier;
import com.rebalanceradar.notification.NotificationChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;

/**
 * Creates the strategy (first-seen wins) and counts it once for its user and day.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StrategyCreatedHandler implements ChainEventHandler<StrategyCreated> {

    static final String USER_ROLLUP = "user";
    static final String DAILY_ROLLUP = "daily";

    private final IdempotentRecordStore recordStore;
    private final RollupLedger rollupLedger;
    private final UserAccountRepository userAccountRepository;
    private final DailyStatsRepository dailyStatsRepository;
    private final ChangeNotifier changeNotifier;

    @Override
    public EventKind kind() {
        return EventKind.STRATEGY_CREATED;
    }

    @Override
    public void handle(StrategyCreated event) {
        EventMeta meta = event.meta();
        String key = StrategyLookup.keyOf(event);
        IdempotentRecordStore.InsertOutcome<Strategy> outcome =
                recordStore.insertIfAbsent(newStrategy(event, key), key, Strategy.class);
        if (!outcome.created() && conflicts(outcome.stored(), event)) {
            log.warn("Conflicting StrategyCreated for {} at {}; keeping first-seen state", key, meta.recordKey());
        }

        rollupLedger.applyOnce(Strategy.class, key, USER_ROLLUP,
                () -> userAccountRepository.recordStrategyCreated(event.user(), meta.blockTimestamp()));
        rollupLedger.applyOnce(Strategy.class, key, DAILY_ROLLUP,
                () -> dailyStatsRepository.recordStrategyCreated(meta.chainId(), DailyStats.dateOf(meta.blockTimestamp()),
                        event.user(), key));

        if (outcome.created()) {
            log.info("Indexed strategy {} '{}' with {} token(s)", key, event.name(), event.tokens().size());
            Map<String, Object> fields = NotificationFields.of(event);
            fields.put("name", event.name());
            fields.put("tokens", event.tokens());
            fields.put("weights", event.weights());
            changeNotifier.publish(NotificationChannel.STRATEGY_CREATED, fields);
        }
    }

    private static Strategy newStrategy(StrategyCreated event, String key) {
        EventMeta meta = event.meta();
        Strategy strategy = new Strategy();
        strategy.setId(key);
        strategy.setChainId(meta.chainId());
        strategy.setUserAddress(event.user());
        strategy.setStrategyId(event.strategyId());
        strategy.setName(event.name());
        strategy.setTokens(new ArrayList<>(event.tokens()));
        strategy.setWeights(new ArrayList<>(event.weights()));
        strategy.setRebalanceInterval(Strategy.DEFAULT_REBALANCE_INTERVAL_SECONDS);
        strategy.setActive(true);
        strategy.setPaused(false);
        strategy.setTotalVolume(BigDecimal.ZERO);
        strategy.setTotalGasSpentWei(BigDecimal.ZERO);
        strategy.setCreatedPosition(meta.position());
        strategy.setPausePosition(meta.position());
        strategy.setAllocationPosition(meta.position());
        strategy.setCreatedAt(meta.blockTimestamp());
        strategy.setUpdatedAt(meta.blockTimestamp());
        return strategy;
    }

    /** Allocation is only comparable while no update has replaced it. */
    private static boolean conflicts(Strategy stored, StrategyCreated event) {
        if (stored.getCreatedPosition() != event.meta().position() || !Objects.equals(stored.getName(), event.name())) {
            return true;
        }
        if (stored.getAllocationPosition() != stored.getCreatedPosition()) {
            return false;
        }
        return !stored.getTokens().equals(event.tokens()) || !stored.getWeights().equals(event.weights());
    }
}
