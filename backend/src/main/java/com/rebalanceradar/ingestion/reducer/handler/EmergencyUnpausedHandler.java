package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.SystemEvent.SystemEventType;
import com.rebalanceradar.ingestion.event.ChainEvent.EmergencyUnpaused;
import com.rebalanceradar.ingestion.event.EventKind;
import com.rebalanceradar.ingestion.store.IdempotentRecordStore;
import com.rebalanceradar.notification.ChangeNotifier;
import com.rebalanceradar.notification.NotificationChannel;
import org.springframework.stereotype.Component;

@Component
public class EmergencyUnpausedHandler extends AbstractSystemEventHandler<EmergencyUnpaused> {

    public EmergencyUnpausedHandler(IdempotentRecordStore recordStore, ChangeNotifier changeNotifier) {
        super(recordStore, changeNotifier);
    }

    @Override
    public EventKind kind() {
        return EventKind.EMERGENCY_UNPAUSED;
    }

    @Override
    public void handle(EmergencyUnpaused event) {
        record(event, SystemEventType.EMERGENCY_UNPAUSE, e -> e.setPausedBy(event.caller()), NotificationChannel.SYSTEM_ALERT);
    }
}
