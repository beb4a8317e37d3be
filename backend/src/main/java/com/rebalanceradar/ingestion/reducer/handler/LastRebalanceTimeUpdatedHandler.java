package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.StrategyRepository;
import com.rebalanceradar.ingestion.event.ChainEvent.LastRebalanceTimeUpdated;
import com.rebalanceradar.ingestion.event.EventKind;
import com.rebalanceradar.ingestion.reducer.ChainEventHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LastRebalanceTimeUpdatedHandler implements ChainEventHandler<LastRebalanceTimeUpdated> {

    private final StrategyRepository strategyRepository;
    private final StrategyLookup strategyLookup;

    @Override
    public EventKind kind() {
        return EventKind.LAST_REBALANCE_TIME_UPDATED;
    }

    @Override
    public void handle(LastRebalanceTimeUpdated event) {
        boolean changed = strategyRepository.advanceLastRebalanceTime(StrategyLookup.keyOf(event),
                event.lastRebalanceTime(), event.meta().blockTimestamp());
        if (!changed) {
            strategyLookup.requireIndexed(event);
        }
    }
}
