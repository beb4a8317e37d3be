package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.ingestion.event.ChainEvent;
import com.rebalanceradar.ingestion.event.EventMeta;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Common notification payload fields.
 */
final class NotificationFields {

    private NotificationFields() {
    }

    static Map<String, Object> of(EventMeta meta) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("chainId", meta.chainId());
        fields.put("txHash", meta.txHash());
        fields.put("blockNumber", meta.blockNumber());
        fields.put("logIndex", meta.logIndex());
        fields.put("blockTimestamp", meta.blockTimestamp());
        return fields;
    }

    static Map<String, Object> of(ChainEvent.StrategyScoped event) {
        Map<String, Object> fields = of(event.meta());
        fields.put("user", event.user());
        fields.put("strategyId", event.strategyId().toString());
        fields.put("strategyKey", StrategyLookup.keyOf(event));
        return fields;
    }
}
