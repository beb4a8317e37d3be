package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.SystemEvent.SystemEventType;
import com.rebalanceradar.ingestion.event.ChainEvent.DexApprovalUpdated;
import com.rebalanceradar.ingestion.event.EventKind;
import com.rebalanceradar.ingestion.store.IdempotentRecordStore;
import com.rebalanceradar.notification.ChangeNotifier;
import com.rebalanceradar.notification.NotificationChannel;
import org.springframework.stereotype.Component;

@Component
public class DexApprovalUpdatedHandler extends AbstractSystemEventHandler<DexApprovalUpdated> {

    public DexApprovalUpdatedHandler(IdempotentRecordStore recordStore, ChangeNotifier changeNotifier) {
        super(recordStore, changeNotifier);
    }

    @Override
    public EventKind kind() {
        return EventKind.DEX_APPROVAL_UPDATED;
    }

    @Override
    public void handle(DexApprovalUpdated event) {
        SystemEventType type = event.approved() ? SystemEventType.DEX_APPROVAL : SystemEventType.DEX_REVOCATION;
        record(event, type, e -> {
            e.setDexAddress(event.dex());
            e.setApproved(event.approved());
        }, NotificationChannel.EVENT_INDEXED);
    }
}
