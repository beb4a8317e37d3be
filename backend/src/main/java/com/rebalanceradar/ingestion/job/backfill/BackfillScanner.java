package com.rebalanceradar.ingestion.job.backfill;

import com.rebalanceradar.domain.ChainIndexState;
import com.rebalanceradar.domain.ChainIndexStateRepository;
import com.rebalanceradar.domain.SupportedChain;
import com.rebalanceradar.ingestion.adapter.ChainClient;
import com.rebalanceradar.ingestion.adapter.ContractEventSource;
import com.rebalanceradar.ingestion.adapter.RpcException;
import com.rebalanceradar.ingestion.config.BackfillProperties;
import com.rebalanceradar.ingestion.config.IngestionChainProperties;
import com.rebalanceradar.ingestion.event.RawChainEvent;
import com.rebalanceradar.ingestion.queue.IngestionQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Historical scan of one chain in fixed block batches. Every event of a batch is enqueued before
 * the chain's latestIndexedBlock moves past it, so a crash never skips blocks; it can only
 * rescan the batch in flight. Only the holder of the chain's lease may scan.
 */
@Slf4j
@Component
public class BackfillScanner {

    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);
    private final Set<SupportedChain> pauseRequested = ConcurrentHashMap.newKeySet();

    private final ContractEventSource eventSource;
    private final ChainClient chainClient;
    private final IngestionQueue queue;
    private final ChainIndexStateRepository stateRepository;
    private final IngestionChainProperties chainProperties;
    private final BackfillProperties backfillProperties;
    private final Clock clock;

    @Autowired
    public BackfillScanner(ContractEventSource eventSource, ChainClient chainClient, IngestionQueue queue,
                           ChainIndexStateRepository stateRepository, IngestionChainProperties chainProperties,
                           BackfillProperties backfillProperties) {
        this(eventSource, chainClient, queue, stateRepository, chainProperties, backfillProperties, Clock.systemUTC());
    }

    BackfillScanner(ContractEventSource eventSource, ChainClient chainClient, IngestionQueue queue,
                    ChainIndexStateRepository stateRepository, IngestionChainProperties chainProperties,
                    BackfillProperties backfillProperties, Clock clock) {
        this.eventSource = eventSource;
        this.chainClient = chainClient;
        this.queue = queue;
        this.stateRepository = stateRepository;
        this.chainProperties = chainProperties;
        this.backfillProperties = backfillProperties;
        this.clock = clock;
    }

    /**
     * Scans [fromBlock, toBlock]; null bounds default to the deployment block and the current head.
     */
    public BackfillResult run(SupportedChain chain, Long fromBlock, Long toBlock) {
        return scan(acquire(chain), fromBlock, toBlock);
    }

    /**
     * Continues after the last indexed block up to the current head.
     */
    public BackfillResult resume(SupportedChain chain) {
        BackfillLease lease = acquire(chain);
        return scan(lease, resumeFrom(lease), null);
    }

    /**
     * @throws com.rebalanceradar.ingestion.config.UnknownChainException if the chain is not configured
     * @throws BackfillAlreadyRunningException if another scan of the chain holds a live lease
     */
    public BackfillLease acquire(SupportedChain chain) {
        chainProperties.require(chain);
        String owner = instanceId + "-" + UUID.randomUUID();
        Instant now = clock.instant();
        Optional<ChainIndexState> state = stateRepository.tryAcquireBackfillLease(
                chain.chainId(), owner, now, now.plusMillis(backfillProperties.getLeaseTtlMs()));
        if (state.isEmpty()) {
            throw new BackfillAlreadyRunningException("Backfill already running on " + chain,
                    leaseHeldUntil(chain).orElse(null));
        }
        pauseRequested.remove(chain);
        return new BackfillLease(chain, owner, state.get().getLatestIndexedBlock());
    }

    /**
     * Expiry of the chain's current lease, or empty when no scan holds it. A past expiry means the
     * holder stopped renewing, typically because its process died mid-scan.
     */
    public Optional<Instant> leaseHeldUntil(SupportedChain chain) {
        return stateRepository.findById(chain.chainId())
                .filter(s -> s.getBackfillOwner() != null)
                .map(ChainIndexState::getBackfillLeaseUntil);
    }

    public long resumeFrom(BackfillLease lease) {
        if (lease.latestIndexedBlock() != null) {
            return lease.latestIndexedBlock() + 1;
        }
        return chainProperties.require(lease.chain()).getDeploymentBlock();
    }

    /**
     * Runs the batches for a held lease and releases it when done, paused or failed.
     */
    public BackfillResult scan(BackfillLease lease, Long fromBlock, Long toBlock) {
        SupportedChain chain = lease.chain();
        String lastError = null;
        try {
            IngestionChainProperties.ChainEntry entry = chainProperties.require(chain);
            long from = fromBlock != null ? fromBlock : entry.getDeploymentBlock();
            long to = toBlock != null ? toBlock : chainClient.getLatestBlock(chain);
            long batchSize = Math.max(1, entry.getBatchBlockSize() != null
                    ? entry.getBatchBlockSize() : backfillProperties.getBatchBlockSize());
            stateRepository.recordBackfillTarget(chain.chainId(), lease.owner(), to);
            log.info("Backfill {} started: blocks {}-{} in batches of {}", chain, from, to, batchSize);

            long events = 0;
            long blocks = 0;
            long lastIndexed = from - 1;
            for (long start = from; start <= to; start += batchSize) {
                long end = Math.min(to, start + batchSize - 1);
                List<RawChainEvent> batch = eventSource.fetchEvents(chain, start, end);
                int enqueued = 0;
                for (RawChainEvent event : batch) {
                    if (queue.enqueue(event)) {
                        enqueued++;
                    }
                }
                Optional<ChainIndexState> state = stateRepository.recordBackfillBatch(chain.chainId(), lease.owner(), end,
                        clock.instant().plusMillis(backfillProperties.getLeaseTtlMs()));
                events += batch.size();
                blocks += end - start + 1;
                if (state.isEmpty()) {
                    log.warn("Backfill {} lost its lease after block {}; stopping", chain, end);
                    return result(chain, from, to, lastIndexed, events, blocks, BackfillResult.Status.LEASE_LOST);
                }
                lastIndexed = end;
                log.debug("Backfill {} batch {}-{}: {} event(s), {} new in queue", chain, start, end, batch.size(), enqueued);

                if (end < to) {
                    if (state.get().isPauseRequested() || pauseRequested.remove(chain) || !interBatchDelay()) {
                        log.info("Backfill {} paused after block {}", chain, end);
                        return result(chain, from, to, lastIndexed, events, blocks, BackfillResult.Status.PAUSED);
                    }
                }
            }
            log.info("Backfill {} completed: {} block(s), {} event(s)", chain, blocks, events);
            return result(chain, from, to, lastIndexed, events, blocks, BackfillResult.Status.COMPLETED);
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.error("Backfill {} failed: {}", chain, e.getMessage(), e);
            throw e;
        } finally {
            pauseRequested.remove(chain);
            stateRepository.releaseBackfillLease(chain.chainId(), lease.owner(), lastError);
        }
    }

    /** Gives the lease back without scanning, e.g. when the scan could not be scheduled. */
    public void release(BackfillLease lease, String reason) {
        stateRepository.releaseBackfillLease(lease.chain().chainId(), lease.owner(), reason);
    }

    /**
     * Asks every running scan to stop after its current batch. In-flight queue items are untouched.
     *
     * @return scans flagged
     */
    public long pause() {
        for (SupportedChain chain : chainProperties.configuredChains()) {
            pauseRequested.add(chain);
        }
        long flagged = stateRepository.requestPauseAll();
        log.info("Backfill pause requested ({} running)", flagged);
        return flagged;
    }

    public boolean pause(SupportedChain chain) {
        pauseRequested.add(chain);
        return stateRepository.requestPause(chain.chainId());
    }

    public BackfillProgress getProgress(SupportedChain chain) {
        IngestionChainProperties.ChainEntry entry = chainProperties.require(chain);
        Optional<ChainIndexState> state = stateRepository.findById(chain.chainId());
        boolean backfilling = state.map(s -> s.isBackfillLeaseHeld(clock.instant())).orElse(false);
        Long latestIndexed = state.map(ChainIndexState::getLatestIndexedBlock).orElse(null);
        Long currentBlock;
        try {
            currentBlock = chainClient.getLatestBlock(chain);
        } catch (RpcException e) {
            log.warn("Cannot read head of {} for progress: {}", chain, e.getMessage());
            currentBlock = state.map(ChainIndexState::getBackfillTargetBlock).orElse(null);
        }
        long indexedUpTo = latestIndexed != null ? latestIndexed : entry.getDeploymentBlock() - 1;
        long remaining = currentBlock != null ? Math.max(0, currentBlock - indexedUpTo) : 0;
        return new BackfillProgress(backfilling, currentBlock, latestIndexed, remaining);
    }

    private boolean interBatchDelay() {
        long delayMs = backfillProperties.getInterBatchDelayMs();
        if (delayMs <= 0) return true;
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static BackfillResult result(SupportedChain chain, long from, long to, long lastIndexed, long events,
                                         long blocks, BackfillResult.Status status) {
        return new BackfillResult(chain, from, to, lastIndexed, events, blocks, status);
    }
}
