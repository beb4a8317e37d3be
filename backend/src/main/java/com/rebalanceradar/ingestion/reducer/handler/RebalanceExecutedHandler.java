package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.DailyStats;
import com.rebalanceradar.domain.DailyStatsRepository;
import com.rebalanceradar.domain.Rebalance;
import com.rebalanceradar.domain.Rebalance.RebalanceStatus;
import com.rebalanceradar.domain.StrategyRepository;
import com.rebalanceradar.domain.UserAccountRepository;
import com.rebalanceradar.ingestion.event.ChainEvent.RebalanceExecuted;
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
import java.util.Map;

/**
 * Records a successful rebalance and folds it into the strategy, user and daily statistics.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RebalanceExecutedHandler implements ChainEventHandler<RebalanceExecuted> {

    static final String STRATEGY_ROLLUP = "strategy";
    static final String USER_ROLLUP = "user";
    static final String DAILY_ROLLUP = "daily";

    private final IdempotentRecordStore recordStore;
    private final RollupLedger rollupLedger;
    private final StrategyLookup strategyLookup;
    private final StrategyRepository strategyRepository;
    private final UserAccountRepository userAccountRepository;
    private final DailyStatsRepository dailyStatsRepository;
    private final ChangeNotifier changeNotifier;

    @Override
    public EventKind kind() {
        return EventKind.REBALANCE_EXECUTED;
    }

    @Override
    public void handle(RebalanceExecuted event) {
        strategyLookup.requireIndexed(event);
        EventMeta meta = event.meta();
        String id = meta.recordKey();
        String strategyKey = StrategyLookup.keyOf(event);
        BigDecimal gasSpent = gasSpentWei(event);
        double driftPercentage = event.driftPercentage();

        IdempotentRecordStore.InsertOutcome<Rebalance> outcome =
                recordStore.insertIfAbsent(newRebalance(event, strategyKey), id, Rebalance.class);

        rollupLedger.applyOnce(Rebalance.class, id, STRATEGY_ROLLUP,
                () -> strategyRepository.recordRebalance(strategyKey, driftPercentage, gasSpent,
                        event.executedAt(), meta.blockTimestamp()));
        rollupLedger.applyOnce(Rebalance.class, id, USER_ROLLUP,
                () -> userAccountRepository.recordRebalance(event.user(), gasSpent, meta.blockTimestamp()));
        rollupLedger.applyOnce(Rebalance.class, id, DAILY_ROLLUP,
                () -> dailyStatsRepository.recordRebalance(meta.chainId(), DailyStats.dateOf(meta.blockTimestamp()),
                        driftPercentage, gasSpent, event.user(), strategyKey));

        if (outcome.created()) {
            Map<String, Object> fields = NotificationFields.of(event);
            fields.put("rebalanceId", id);
            fields.put("drift", event.drift());
            fields.put("driftPercentage", driftPercentage);
            fields.put("gasSpentWei", gasSpent.toPlainString());
            fields.put("executor", event.executor());
            changeNotifier.publish(NotificationChannel.REBALANCE_COMPLETED, fields);
        }
    }

    /** Receipt gas (gasUsed * effective price) when known, else the reimbursed amount. */
    static BigDecimal gasSpentWei(RebalanceExecuted event) {
        if (event.gasUsed() != null && event.gasPrice() != null) {
            return new BigDecimal(event.gasUsed().multiply(event.gasPrice()));
        }
        return event.gasReimbursed() != null ? new BigDecimal(event.gasReimbursed()) : BigDecimal.ZERO;
    }

    private static Rebalance newRebalance(RebalanceExecuted event, String strategyKey) {
        EventMeta meta = event.meta();
        Rebalance rebalance = new Rebalance();
        rebalance.setId(meta.recordKey());
        rebalance.setChainId(meta.chainId());
        rebalance.setStrategyKey(strategyKey);
        rebalance.setUserAddress(event.user());
        rebalance.setTxHash(meta.txHash());
        rebalance.setBlockNumber(meta.blockNumber());
        rebalance.setBlockTimestamp(meta.blockTimestamp());
        rebalance.setLogIndex(meta.logIndex());
        rebalance.setStatus(RebalanceStatus.SUCCESS);
        rebalance.setDrift(event.drift());
        rebalance.setDriftPercentage(event.driftPercentage());
        rebalance.setGasReimbursed(event.gasReimbursed());
        rebalance.setGasUsed(event.gasUsed());
        rebalance.setGasPrice(event.gasPrice());
        rebalance.setExecutor(event.executor());
        rebalance.setExecutedAt(event.executedAt());
        rebalance.setTotalVolumeIn(BigDecimal.ZERO);
        rebalance.setTotalVolumeOut(BigDecimal.ZERO);
        return rebalance;
    }
}
