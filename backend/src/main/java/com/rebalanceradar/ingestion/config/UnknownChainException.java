package com.rebalanceradar.ingestion.config;

/**
 * Operator asked for a chain that is not configured.
 */
public class UnknownChainException extends IllegalArgumentException {

    public UnknownChainException(String message) {
        super(message);
    }
}
