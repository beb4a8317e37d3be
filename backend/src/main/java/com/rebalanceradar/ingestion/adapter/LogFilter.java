package com.rebalanceradar.ingestion.adapter;

import java.util.List;

/**
 * eth_getLogs filter: any of the contract addresses, any of the topic0 values.
 */
public record LogFilter(List<String> addresses, List<String> topic0Any) {

    public LogFilter {
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
        topic0Any = topic0Any == null ? List.of() : List.copyOf(topic0Any);
    }
}
