package com.rebalanceradar.ingestion.event;

/**
 * Thrown when a queued event cannot be turned into a typed {@link ChainEvent}. Not retryable.
 */
public class EventDecodingException extends RuntimeException {

    public EventDecodingException(String message) {
        super(message);
    }

    public EventDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
