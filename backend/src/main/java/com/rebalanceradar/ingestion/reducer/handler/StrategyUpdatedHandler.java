package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.StrategyRepository;
import com.rebalanceradar.ingestion.event.ChainEvent.StrategyUpdated;
import com.rebalanceradar.ingestion.event.EventKind;
import com.rebalanceradar.ingestion.reducer.ChainEventHandler;
import com.rebalanceradar.notification.ChangeNotifier;
import com.rebalanceradar.notification.NotificationChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Replaces tokens and weights when the update is newer than the stored allocation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StrategyUpdatedHandler implements ChainEventHandler<StrategyUpdated> {

    private final StrategyRepository strategyRepository;
    private final StrategyLookup strategyLookup;
    private final ChangeNotifier changeNotifier;

    @Override
    public EventKind kind() {
        return EventKind.STRATEGY_UPDATED;
    }

    @Override
    public void handle(StrategyUpdated event) {
        String key = StrategyLookup.keyOf(event);
        boolean changed = strategyRepository.applyAllocation(key, event.tokens(), event.weights(),
                event.meta().position(), event.meta().blockTimestamp());
        if (!changed) {
            strategyLookup.requireIndexed(event);
            log.debug("Ignoring stale or post-delete StrategyUpdated for {} at {}", key, event.meta().recordKey());
            return;
        }
        Map<String, Object> fields = NotificationFields.of(event);
        fields.put("tokens", event.tokens());
        fields.put("weights", event.weights());
        changeNotifier.publish(NotificationChannel.STRATEGY_UPDATED, fields);
    }
}
