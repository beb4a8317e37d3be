package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.DailyStats;
import com.rebalanceradar.domain.DailyStatsRepository;
import com.rebalanceradar.domain.Rebalance;
import com.rebalanceradar.domain.Rebalance.RebalanceStatus;
import com.rebalanceradar.ingestion.event.ChainEvent.RebalanceFailed;
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

import java.util.Map;

/**
 * Records a failed rebalance attempt; only the daily failure counter moves.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RebalanceFailedHandler implements ChainEventHandler<RebalanceFailed> {

    static final String DAILY_ROLLUP = "daily";

    private final IdempotentRecordStore recordStore;
    private final RollupLedger rollupLedger;
    private final DailyStatsRepository dailyStatsRepository;
    private final ChangeNotifier changeNotifier;

    @Override
    public EventKind kind() {
        return EventKind.REBALANCE_FAILED;
    }

    @Override
    public void handle(RebalanceFailed event) {
        EventMeta meta = event.meta();
        String id = meta.recordKey();
        String strategyKey = StrategyLookup.keyOf(event);

        Rebalance rebalance = new Rebalance();
        rebalance.setId(id);
        rebalance.setChainId(meta.chainId());
        rebalance.setStrategyKey(strategyKey);
        rebalance.setUserAddress(event.user());
        rebalance.setTxHash(meta.txHash());
        rebalance.setBlockNumber(meta.blockNumber());
        rebalance.setBlockTimestamp(meta.blockTimestamp());
        rebalance.setLogIndex(meta.logIndex());
        rebalance.setStatus(RebalanceStatus.FAILED);
        rebalance.setFailureReason(event.reason());
        IdempotentRecordStore.InsertOutcome<Rebalance> outcome = recordStore.insertIfAbsent(rebalance, id, Rebalance.class);

        rollupLedger.applyOnce(Rebalance.class, id, DAILY_ROLLUP,
                () -> dailyStatsRepository.recordRebalanceFailed(meta.chainId(), DailyStats.dateOf(meta.blockTimestamp()),
                        event.user(), strategyKey));

        if (outcome.created()) {
            log.info("Rebalance failed for {} at {}: {}", strategyKey, id, event.reason());
            Map<String, Object> fields = NotificationFields.of(event);
            fields.put("rebalanceId", id);
            fields.put("reason", event.reason());
            changeNotifier.publish(NotificationChannel.REBALANCE_FAILED, fields);
        }
    }
}
