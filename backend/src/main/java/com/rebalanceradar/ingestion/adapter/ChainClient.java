package com.rebalanceradar.ingestion.adapter;

import com.rebalanceradar.domain.SupportedChain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to a chain node. All calls block; failures surface as {@link RpcException} once
 * endpoint rotation and retries are exhausted.
 */
public interface ChainClient {

    long getLatestBlock(SupportedChain chain);

    /**
     * Logs in [fromBlock, toBlock] (inclusive) matching the filter, in node order.
     */
    List<ChainLog> getLogs(SupportedChain chain, long fromBlock, long toBlock, LogFilter filter);

    /**
     * @return empty if the node does not know the transaction (e.g. not mined yet or pruned)
     */
    Optional<TransactionReceipt> getTransactionReceipt(SupportedChain chain, String transactionHash);

    Instant getBlockTimestamp(SupportedChain chain, long blockNumber);

    BigInteger getGasPrice(SupportedChain chain);
}
