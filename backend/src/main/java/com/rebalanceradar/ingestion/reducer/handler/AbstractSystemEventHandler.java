package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.SystemEvent;
import com.rebalanceradar.domain.SystemEvent.SystemEventType;
import com.rebalanceradar.ingestion.event.ChainEvent;
import com.rebalanceradar.ingestion.event.EventMeta;
import com.rebalanceradar.ingestion.reducer.ChainEventHandler;
import com.rebalanceradar.ingestion.store.IdempotentRecordStore;
import com.rebalanceradar.notification.ChangeNotifier;
import com.rebalanceradar.notification.NotificationChannel;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Contract-level events are stored once as immutable {@link SystemEvent}s and announced when first seen.
 */
@Slf4j
abstract class AbstractSystemEventHandler<E extends ChainEvent> implements ChainEventHandler<E> {

    private final IdempotentRecordStore recordStore;
    private final ChangeNotifier changeNotifier;

    protected AbstractSystemEventHandler(IdempotentRecordStore recordStore, ChangeNotifier changeNotifier) {
        this.recordStore = recordStore;
        this.changeNotifier = changeNotifier;
    }

    protected void record(E event, SystemEventType type, Consumer<SystemEvent> details, NotificationChannel channel) {
        EventMeta meta = event.meta();
        SystemEvent systemEvent = new SystemEvent();
        systemEvent.setId(meta.recordKey());
        systemEvent.setChainId(meta.chainId());
        systemEvent.setType(type);
        systemEvent.setTxHash(meta.txHash());
        systemEvent.setBlockNumber(meta.blockNumber());
        systemEvent.setBlockTimestamp(meta.blockTimestamp());
        systemEvent.setLogIndex(meta.logIndex());
        details.accept(systemEvent);

        IdempotentRecordStore.InsertOutcome<SystemEvent> outcome =
                recordStore.insertIfAbsent(systemEvent, meta.recordKey(), SystemEvent.class);
        if (!outcome.created()) {
            return;
        }
        log.info("System event {} on chain {} at {}", type, meta.chainId(), meta.recordKey());
        Map<String, Object> fields = NotificationFields.of(meta);
        fields.put("type", type.name());
        fields.put("dexAddress", systemEvent.getDexAddress());
        fields.put("approved", systemEvent.getApproved());
        fields.put("pausedBy", systemEvent.getPausedBy());
        fields.put("oldExecutor", systemEvent.getOldExecutor());
        fields.put("newExecutor", systemEvent.getNewExecutor());
        changeNotifier.publish(channel, fields);
    }
}
