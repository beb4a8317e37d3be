package com.rebalanceradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Per-chain scan progress and the backfill lease. Id = chain id.
 * latestIndexedBlock belongs to the backfill scanner, liveBlock to the live subscriber.
 */
@Document(collection = "chain_index_state")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ChainIndexState {

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    private Long latestIndexedBlock;
    private Long backfillTargetBlock;
    private Long liveBlock;

    /** Holder of the backfill lease; null when no scan runs. */
    private String backfillOwner;
    private Instant backfillLeaseUntil;
    private boolean pauseRequested;
    private String lastError;
    private Instant updatedAt;

    public boolean isBackfillLeaseHeld(Instant now) {
        return backfillOwner != null && backfillLeaseUntil != null && backfillLeaseUntil.isAfter(now);
    }
}
