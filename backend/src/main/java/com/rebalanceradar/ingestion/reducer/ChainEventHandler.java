package com.rebalanceradar.ingestion.reducer;

import com.rebalanceradar.ingestion.event.ChainEvent;
import com.rebalanceradar.ingestion.event.EventKind;

/**
 * Idempotent reduction of one event kind into the canonical state. Handling the same event twice
 * leaves the store as after the first time.
 */
public interface ChainEventHandler<E extends ChainEvent> {

    EventKind kind();

    void handle(E event);
}
