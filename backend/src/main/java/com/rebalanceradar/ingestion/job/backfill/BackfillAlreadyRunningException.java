package com.rebalanceradar.ingestion.job.backfill;

import java.time.Instant;

/**
 * A backfill for the chain holds the lease; a second one is refused.
 */
public class BackfillAlreadyRunningException extends RuntimeException {

    /** Expiry of the lease that blocked the request, when known. */
    private final Instant heldUntil;

    public BackfillAlreadyRunningException(String message) {
        this(message, (Instant) null);
    }

    public BackfillAlreadyRunningException(String message, Instant heldUntil) {
        super(message);
        this.heldUntil = heldUntil;
    }

    public Instant getHeldUntil() {
        return heldUntil;
    }
}
