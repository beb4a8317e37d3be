package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.Strategy;
import com.rebalanceradar.domain.StrategyRepository;
import com.rebalanceradar.domain.UserAccountRepository;
import com.rebalanceradar.ingestion.event.ChainEvent.StrategyDeleted;
import com.rebalanceradar.ingestion.event.EventKind;
import com.rebalanceradar.ingestion.reducer.ChainEventHandler;
import com.rebalanceradar.ingestion.reducer.StrategyNotIndexedException;
import com.rebalanceradar.ingestion.store.RollupLedger;
import com.rebalanceradar.notification.ChangeNotifier;
import com.rebalanceradar.notification.NotificationChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Soft-deletes a strategy. Deactivation is terminal and decrements the owner's strategy count once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StrategyDeletedHandler implements ChainEventHandler<StrategyDeleted> {

    static final String USER_DELETE_ROLLUP = "user-delete";

    private final StrategyRepository strategyRepository;
    private final StrategyLookup strategyLookup;
    private final RollupLedger rollupLedger;
    private final UserAccountRepository userAccountRepository;
    private final ChangeNotifier changeNotifier;

    @Override
    public EventKind kind() {
        return EventKind.STRATEGY_DELETED;
    }

    @Override
    public void handle(StrategyDeleted event) {
        String key = StrategyLookup.keyOf(event);
        boolean changed = strategyRepository.markDeleted(key, event.meta().blockTimestamp());
        if (!changed) {
            Strategy stored = strategyLookup.require(event);
            if (stored.isActive()) {
                throw new StrategyNotIndexedException("Strategy " + key + " still active after delete at "
                        + event.meta().recordKey());
            }
        }
        rollupLedger.applyOnce(Strategy.class, key, USER_DELETE_ROLLUP,
                () -> userAccountRepository.recordStrategyDeleted(event.user(), event.meta().blockTimestamp()));
        if (changed) {
            log.info("Strategy {} deleted at {}", key, event.meta().recordKey());
            changeNotifier.publish(NotificationChannel.STRATEGY_DELETED, NotificationFields.of(event));
        }
    }
}
