package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.Strategy;
import com.rebalanceradar.domain.StrategyRepository;
import com.rebalanceradar.ingestion.event.ChainEvent;
import com.rebalanceradar.ingestion.reducer.StrategyNotIndexedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves the strategy an event refers to.
 */
@Component
@RequiredArgsConstructor
class StrategyLookup {

    private final StrategyRepository strategyRepository;

    static String keyOf(ChainEvent.StrategyScoped event) {
        return Strategy.key(event.meta().chainId(), event.user(), event.strategyId());
    }

    /**
     * @throws StrategyNotIndexedException if the strategy has not been created yet
     */
    Strategy require(ChainEvent.StrategyScoped event) {
        String key = keyOf(event);
        return strategyRepository.findById(key)
                .orElseThrow(() -> new StrategyNotIndexedException(event.kind().eventName() + " at "
                        + event.meta().recordKey() + " refers to unknown strategy " + key));
    }

    void requireIndexed(ChainEvent.StrategyScoped event) {
        String key = keyOf(event);
        if (!strategyRepository.existsById(key)) {
            throw new StrategyNotIndexedException(event.kind().eventName() + " at " + event.meta().recordKey()
                    + " refers to unknown strategy " + key);
        }
    }
}
