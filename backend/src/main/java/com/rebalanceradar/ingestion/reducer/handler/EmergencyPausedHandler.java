package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.SystemEvent.SystemEventType;
import com.rebalanceradar.ingestion.event.ChainEvent.EmergencyPaused;
import com.rebalanceradar.ingestion.event.EventKind;
import com.rebalanceradar.ingestion.store.IdempotentRecordStore;
import com.rebalanceradar.notification.ChangeNotifier;
import com.rebalanceradar.notification.NotificationChannel;
import org.springframework.stereotype.Component;

/**
 * Contract-wide emergency stop; raised as a system alert.
 */
@Component
public class EmergencyPausedHandler extends AbstractSystemEventHandler<EmergencyPaused> {

    public EmergencyPausedHandler(IdempotentRecordStore recordStore, ChangeNotifier changeNotifier) {
        super(recordStore, changeNotifier);
    }

    @Override
    public EventKind kind() {
        return EventKind.EMERGENCY_PAUSED;
    }

    @Override
    public void handle(EmergencyPaused event) {
        record(event, SystemEventType.EMERGENCY_PAUSE, e -> e.setPausedBy(event.caller()), NotificationChannel.SYSTEM_ALERT);
    }
}
