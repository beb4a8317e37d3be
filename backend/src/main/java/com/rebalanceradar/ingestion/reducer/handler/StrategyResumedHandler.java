package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.StrategyRepository;
import com.rebalanceradar.ingestion.event.ChainEvent.StrategyResumed;
import com.rebalanceradar.ingestion.event.EventKind;
import com.rebalanceradar.ingestion.reducer.ChainEventHandler;
import com.rebalanceradar.notification.ChangeNotifier;
import com.rebalanceradar.notification.NotificationChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resumes an active strategy unless a newer pause or resume was already applied.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StrategyResumedHandler implements ChainEventHandler<StrategyResumed> {

    private final StrategyRepository strategyRepository;
    private final StrategyLookup strategyLookup;
    private final ChangeNotifier changeNotifier;

    @Override
    public EventKind kind() {
        return EventKind.STRATEGY_RESUMED;
    }

    @Override
    public void handle(StrategyResumed event) {
        String key = StrategyLookup.keyOf(event);
        boolean changed = strategyRepository.applyPauseState(key, false, event.meta().position(),
                event.meta().blockTimestamp());
        if (!changed) {
            strategyLookup.requireIndexed(event);
            log.debug("Ignoring stale or post-delete StrategyResumed for {} at {}", key, event.meta().recordKey());
            return;
        }
        changeNotifier.publish(NotificationChannel.STRATEGY_RESUMED, NotificationFields.of(event));
    }
}
