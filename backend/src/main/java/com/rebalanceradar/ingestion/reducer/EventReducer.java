package com.rebalanceradar.ingestion.reducer;

import com.rebalanceradar.ingestion.event.ChainEvent;
import com.rebalanceradar.ingestion.event.ChainEventDecoder;
import com.rebalanceradar.ingestion.event.EventKind;
import com.rebalanceradar.ingestion.event.RawChainEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes a queued raw event and dispatches it to the handler registered for its kind.
 */
@Slf4j
@Component
public class EventReducer {

    private final ChainEventDecoder decoder;
    private final Map<EventKind, ChainEventHandler<?>> handlers = new EnumMap<>(EventKind.class);

    public EventReducer(ChainEventDecoder decoder, List<ChainEventHandler<?>> handlers) {
        this.decoder = decoder;
        for (ChainEventHandler<?> handler : handlers) {
            ChainEventHandler<?> previous = this.handlers.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for " + handler.kind() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        log.info("Event reducer ready with {} handler(s)", this.handlers.size());
    }

    /**
     * @throws com.rebalanceradar.ingestion.event.EventDecodingException if the payload does not match its kind
     */
    public void reduce(RawChainEvent raw) {
        reduce(decoder.decode(raw));
    }

    public void reduce(ChainEvent event) {
        ChainEventHandler<?> handler = handlers.get(event.kind());
        if (handler == null) {
            throw new IllegalStateException("No handler registered for " + event.kind());
        }
        log.debug("Reducing {} {}", event.kind(), event.meta().recordKey());
        dispatch(handler, event);
    }

    @SuppressWarnings("unchecked")
    private static <E extends ChainEvent> void dispatch(ChainEventHandler<E> handler, ChainEvent event) {
        handler.handle((E) event);
    }
}
