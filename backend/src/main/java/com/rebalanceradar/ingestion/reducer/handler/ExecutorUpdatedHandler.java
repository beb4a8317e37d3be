package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.SystemEvent.SystemEventType;
import com.rebalanceradar.ingestion.event.ChainEvent.ExecutorUpdated;
import com.rebalanceradar.ingestion.event.EventKind;
import com.rebalanceradar.ingestion.store.IdempotentRecordStore;
import com.rebalanceradar.notification.ChangeNotifier;
import com.rebalanceradar.notification.NotificationChannel;
import org.springframework.stereotype.Component;

/**
 * Rotation of the address allowed to execute rebalances.
 */
@Component
public class ExecutorUpdatedHandler extends AbstractSystemEventHandler<ExecutorUpdated> {

    public ExecutorUpdatedHandler(IdempotentRecordStore recordStore, ChangeNotifier changeNotifier) {
        super(recordStore, changeNotifier);
    }

    @Override
    public EventKind kind() {
        return EventKind.EXECUTOR_UPDATED;
    }

    @Override
    public void handle(ExecutorUpdated event) {
        record(event, SystemEventType.EXECUTOR_UPDATED, e -> {
            e.setOldExecutor(event.oldExecutor());
            e.setNewExecutor(event.newExecutor());
        }, NotificationChannel.EVENT_INDEXED);
    }
}
