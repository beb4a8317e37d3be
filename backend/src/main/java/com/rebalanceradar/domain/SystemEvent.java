package com.rebalanceradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Protocol-level event (DEX allow-list change, emergency pause, executor rotation). Immutable.
 */
@Document(collection = "system_events")
@CompoundIndex(name = "chain_block", def = "{'chainId': 1, 'blockNumber': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class SystemEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long chainId;
    private SystemEventType type;
    private String txHash;
    private long blockNumber;
    private Instant blockTimestamp;
    private long logIndex;

    private String dexAddress;
    private Boolean approved;
    private String pausedBy;
    private String oldExecutor;
    private String newExecutor;

    public enum SystemEventType {
        DEX_APPROVAL,
        DEX_REVOCATION,
        EMERGENCY_PAUSE,
        EMERGENCY_UNPAUSE,
        EXECUTOR_UPDATED
    }
}
