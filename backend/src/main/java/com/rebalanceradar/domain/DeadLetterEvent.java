package com.rebalanceradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queue item that exhausted its retry budget or could not be decoded. Kept for inspection and replay.
 */
@Document(collection = "dead_letter_events")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DeadLetterEvent {

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

    private int attempts;
    private String lastError;
    private boolean retryable;
    private Instant deadLetteredAt;
}
