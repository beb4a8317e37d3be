package com.rebalanceradar.ingestion.reducer;

/**
 * An event refers to a strategy whose creation has not been reduced yet. Retryable: the create may
 * still be queued on the other ingestion path.
 */
public class StrategyNotIndexedException extends RuntimeException {

    public StrategyNotIndexedException(String message) {
        super(message);
    }

    public StrategyNotIndexedException(String message, Throwable cause) {
        super(message, cause);
    }
}
