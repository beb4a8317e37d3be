package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.DailyStats;
import com.rebalanceradar.domain.DailyStatsRepository;
import com.rebalanceradar.domain.Rebalance;
import com.rebalanceradar.domain.RebalanceRepository;
import com.rebalanceradar.domain.StrategyRepository;
import com.rebalanceradar.domain.Swap;
import com.rebalanceradar.ingestion.event.ChainEvent.SwapExecuted;
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
import java.util.Optional;

/**
 * Attaches a swap to the rebalance logged closest before it in the same transaction. Volume is
 * counted in amountIn units; no price oracle is consulted, so priceImpact stays unset.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SwapExecutedHandler implements ChainEventHandler<SwapExecuted> {

    static final String REBALANCE_ROLLUP = "rebalance";
    static final String STRATEGY_ROLLUP = "strategy";
    static final String DAILY_ROLLUP = "daily";

    private final RebalanceRepository rebalanceRepository;
    private final IdempotentRecordStore recordStore;
    private final RollupLedger rollupLedger;
    private final StrategyRepository strategyRepository;
    private final DailyStatsRepository dailyStatsRepository;
    private final ChangeNotifier changeNotifier;

    @Override
    public EventKind kind() {
        return EventKind.SWAP_EXECUTED;
    }

    @Override
    public void handle(SwapExecuted event) {
        EventMeta meta = event.meta();
        Optional<Rebalance> parent = rebalanceRepository
                .findFirstByChainIdAndTxHashAndLogIndexLessThanOrderByLogIndexDesc(meta.chainId(), meta.txHash(), meta.logIndex());
        if (parent.isEmpty()) {
            log.warn("Dropping SwapExecuted {}: no rebalance logged before it in tx {}", meta.recordKey(), meta.txHash());
            return;
        }
        Rebalance rebalance = parent.get();
        String id = meta.recordKey();
        BigDecimal amountIn = new BigDecimal(event.amountIn());
        BigDecimal amountOut = new BigDecimal(event.amountOut());

        Swap swap = new Swap();
        swap.setId(id);
        swap.setChainId(meta.chainId());
        swap.setRebalanceId(rebalance.getId());
        swap.setStrategyKey(rebalance.getStrategyKey());
        swap.setUserAddress(event.user());
        swap.setTxHash(meta.txHash());
        swap.setBlockNumber(meta.blockNumber());
        swap.setBlockTimestamp(meta.blockTimestamp());
        swap.setLogIndex(meta.logIndex());
        swap.setSwapIndex(meta.logIndex() - rebalance.getLogIndex());
        swap.setTokenIn(event.tokenIn());
        swap.setTokenOut(event.tokenOut());
        swap.setAmountIn(event.amountIn());
        swap.setAmountOut(event.amountOut());
        IdempotentRecordStore.InsertOutcome<Swap> outcome = recordStore.insertIfAbsent(swap, id, Swap.class);

        rollupLedger.applyOnce(Swap.class, id, REBALANCE_ROLLUP,
                () -> rebalanceRepository.recordSwap(rebalance.getId(), amountIn, amountOut));
        rollupLedger.applyOnce(Swap.class, id, STRATEGY_ROLLUP,
                () -> strategyRepository.recordSwap(rebalance.getStrategyKey(), amountIn));
        rollupLedger.applyOnce(Swap.class, id, DAILY_ROLLUP,
                () -> dailyStatsRepository.recordSwap(meta.chainId(), DailyStats.dateOf(meta.blockTimestamp()), amountIn));

        if (outcome.created()) {
            Map<String, Object> fields = NotificationFields.of(meta);
            fields.put("user", event.user());
            fields.put("swapId", id);
            fields.put("rebalanceId", rebalance.getId());
            fields.put("strategyKey", rebalance.getStrategyKey());
            fields.put("tokenIn", event.tokenIn());
            fields.put("tokenOut", event.tokenOut());
            fields.put("amountIn", event.amountIn().toString());
            fields.put("amountOut", event.amountOut().toString());
            changeNotifier.publish(NotificationChannel.SWAP_EXECUTED, fields);
        }
    }
}
