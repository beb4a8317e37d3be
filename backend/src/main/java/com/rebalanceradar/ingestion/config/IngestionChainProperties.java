package com.rebalanceradar.ingestion.config;

import com.rebalanceradar.domain.SupportedChain;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-chain ingestion config. Key = {@link SupportedChain} name (e.g. MONAD_TESTNET, BASE_SEPOLIA).
 * A chain without an entry (or without RPC urls) is not indexed.
 */
@ConfigurationProperties(prefix = "rebalanceradar.ingestion")
@NoArgsConstructor
@Getter
@Setter
public class IngestionChainProperties {

    private Map<String, ChainEntry> chains = new HashMap<>();

    public void setChains(Map<String, ChainEntry> chains) {
        this.chains = chains != null ? chains : new HashMap<>();
    }

    /**
     * @throws UnknownChainException if the chain has no usable entry
     */
    public ChainEntry require(SupportedChain chain) {
        ChainEntry entry = chains.get(chain.name());
        if (entry == null || entry.getUrls().isEmpty()) {
            throw new UnknownChainException("Chain " + chain + " is not configured under rebalanceradar.ingestion.chains");
        }
        return entry;
    }

    /** Chains with at least one RPC url, in enum order. */
    public List<SupportedChain> configuredChains() {
        List<SupportedChain> result = new ArrayList<>();
        for (SupportedChain chain : SupportedChain.values()) {
            ChainEntry entry = chains.get(chain.name());
            if (entry != null && !entry.getUrls().isEmpty()) {
                result.add(chain);
            }
        }
        return result;
    }

    /**
     * One chain's RPC urls, contract addresses and scan settings.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class ChainEntry {

        private List<String> urls = new ArrayList<>();
        /** Contract name → address. All listed contracts are scanned for the known event topics. */
        private Map<String, String> contracts = new LinkedHashMap<>();
        /** Block the contracts were deployed at; default start of a backfill. */
        private long deploymentBlock;
        /** Optional eth_getLogs range override; falls back to backfill.batch-block-size. */
        private Integer batchBlockSize;
        /** Resume the historical scan on startup. */
        private boolean autoResume = true;
        /** Poll new heads for this chain. */
        private boolean liveEnabled = true;

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }

        public void setContracts(Map<String, String> contracts) {
            this.contracts = contracts != null ? contracts : new LinkedHashMap<>();
        }
    }
}
