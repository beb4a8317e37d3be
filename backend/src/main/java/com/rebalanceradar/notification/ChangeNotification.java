package com.rebalanceradar.notification;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload delivered to subscribers. {@code fields} holds the kind-specific values; a value may be null.
 */
public record ChangeNotification(NotificationChannel channel, Instant timestamp, String source, Map<String, Object> fields) {

    public static final String SOURCE = "indexer";

    public ChangeNotification {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
