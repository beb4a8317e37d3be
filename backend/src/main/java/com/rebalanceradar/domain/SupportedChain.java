package com.rebalanceradar.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Chains the strategy contracts are deployed on. The numeric chain id is part of every composite key.
 */
public enum SupportedChain {
    MONAD_TESTNET(10143L),
    BASE_SEPOLIA(84532L),
    BASE_MAINNET(8453L);

    private final long chainId;

    SupportedChain(long chainId) {
        this.chainId = chainId;
    }

    public long chainId() {
        return chainId;
    }

    public static Optional<SupportedChain> fromChainId(long chainId) {
        return Arrays.stream(values()).filter(c -> c.chainId == chainId).findFirst();
    }
}
