package com.rebalanceradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Durable ingestion queue item. Id = {chainId}-{txHash}-{logIndex}, so a log discovered by both
 * the backfill scanner and the live subscriber is stored once. DONE items expire via TTL.
 */
@Document(collection = "ingestion_queue")
@CompoundIndex(name = "partition_ready", def = "{'partition': 1, 'status': 1, 'nextAttemptAt': 1, 'blockNumber': 1, 'logIndex': 1}")
@CompoundIndex(name = "partition_route", def = "{'partition': 1, 'routingKey': 1, 'status': 1}")
@CompoundIndex(name = "status_claimed", def = "{'status': 1, 'claimedAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class QueuedEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long chainId;
    private String eventName;
    private long blockNumber;
    private Instant blockTimestamp;
    private String transactionHash;
    private long logIndex;
    private Map<String, Object> data = new LinkedHashMap<>();

    private String routingKey;
    private int partition;
    private QueueStatus status;
    private int attempts;
    private Instant nextAttemptAt;
    private Instant claimedAt;
    private String lastError;
    private Instant enqueuedAt;

    @Indexed(name = "done_ttl", expireAfterSeconds = 604_800)
    private Instant completedAt;

    public enum QueueStatus {
        PENDING,
        PROCESSING,
        DONE
    }
}
