package com.rebalanceradar.ingestion.job.backfill;

import com.rebalanceradar.config.AsyncConfig;
import com.rebalanceradar.config.SchedulerConfig;
import com.rebalanceradar.domain.SupportedChain;
import com.rebalanceradar.ingestion.config.BackfillProperties;
import com.rebalanceradar.ingestion.config.IngestionChainProperties;
import com.rebalanceradar.notification.ChangeNotifier;
import com.rebalanceradar.notification.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Backfill control: starts scans on the backfill executor, resumes unfinished chains on startup,
 * pauses running scans and reports progress. The lease is taken on the caller's thread so a
 * concurrent request fails immediately. A startup resume blocked by a lease is retried once that
 * lease expires, so a scan orphaned by a crash is picked up again.
 */
@Slf4j
@Component
public class BackfillJobRunner {

    static final long TAKEOVER_MARGIN_MS = 1_000;

    private final BackfillScanner scanner;
    private final IngestionChainProperties chainProperties;
    private final BackfillProperties backfillProperties;
    private final ChangeNotifier changeNotifier;
    private final Executor backfillExecutor;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    @Autowired
    public BackfillJobRunner(BackfillScanner scanner, IngestionChainProperties chainProperties,
                             BackfillProperties backfillProperties, ChangeNotifier changeNotifier,
                             @Qualifier(AsyncConfig.BACKFILL_EXECUTOR) Executor backfillExecutor,
                             @Qualifier(SchedulerConfig.SCHEDULER_POOL) TaskScheduler taskScheduler) {
        this(scanner, chainProperties, backfillProperties, changeNotifier, backfillExecutor, taskScheduler,
                Clock.systemUTC());
    }

    BackfillJobRunner(BackfillScanner scanner, IngestionChainProperties chainProperties,
                      BackfillProperties backfillProperties, ChangeNotifier changeNotifier,
                      Executor backfillExecutor, TaskScheduler taskScheduler, Clock clock) {
        this.scanner = scanner;
        this.chainProperties = chainProperties;
        this.backfillProperties = backfillProperties;
        this.changeNotifier = changeNotifier;
        this.backfillExecutor = backfillExecutor;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!backfillProperties.isAutoResumeOnStartup()) {
            log.info("Backfill auto-resume disabled");
            return;
        }
        int started = 0;
        for (SupportedChain chain : chainProperties.configuredChains()) {
            if (!chainProperties.require(chain).isAutoResume()) continue;
            try {
                resume(chain);
                started++;
            } catch (BackfillAlreadyRunningException e) {
                scheduleTakeover(chain, e.getHeldUntil());
            } catch (RuntimeException e) {
                log.error("Could not resume backfill for {}: {}", chain, e.getMessage(), e);
                alert(chain, e);
            }
        }
        if (started > 0) {
            log.info("Resuming backfill on {} chain(s)", started);
        }
    }

    /**
     * @throws BackfillAlreadyRunningException           if the chain is being scanned
     * @throws com.rebalanceradar.ingestion.config.UnknownChainException if the chain is not configured
     */
    public CompletableFuture<BackfillResult> backfillChain(SupportedChain chain, Long fromBlock, Long toBlock) {
        return submit(scanner.acquire(chain), lease -> scanner.scan(lease, fromBlock, toBlock));
    }

    public CompletableFuture<BackfillResult> resume(SupportedChain chain) {
        return submit(scanner.acquire(chain), lease -> scanner.scan(lease, scanner.resumeFrom(lease), null));
    }

    /**
     * Runs after the blocking lease was due to expire. A lease that is still being renewed pushes the
     * retry back; a lease released in the meantime means its scan ended and nothing is resumed.
     */
    void resumeAbandoned(SupportedChain chain) {
        try {
            Optional<Instant> heldUntil = scanner.leaseHeldUntil(chain);
            if (heldUntil.isEmpty()) {
                log.info("Backfill lease on {} was released; not resuming", chain);
                return;
            }
            if (heldUntil.get().isAfter(clock.instant())) {
                scheduleTakeover(chain, heldUntil.get());
                return;
            }
            log.warn("Backfill lease on {} expired at {} without release; resuming", chain, heldUntil.get());
            resume(chain);
        } catch (BackfillAlreadyRunningException e) {
            scheduleTakeover(chain, e.getHeldUntil());
        } catch (RuntimeException e) {
            log.error("Could not resume backfill for {}: {}", chain, e.getMessage(), e);
            alert(chain, e);
        }
    }

    public long pause() {
        return scanner.pause();
    }

    public BackfillProgress getProgress(SupportedChain chain) {
        return scanner.getProgress(chain);
    }

    private CompletableFuture<BackfillResult> submit(BackfillLease lease, Function<BackfillLease, BackfillResult> scan) {
        CompletableFuture<BackfillResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> scan.apply(lease), backfillExecutor);
        } catch (RejectedExecutionException e) {
            scanner.release(lease, "Backfill executor rejected the scan");
            throw e;
        }
        return future.whenComplete((result, error) -> {
            if (error != null) {
                alert(lease.chain(), error);
            } else {
                log.info("Backfill {} ended {}: blocks {}-{}, {} event(s)", result.chain(), result.status(),
                        result.fromBlock(), result.lastIndexedBlock(), result.eventsProcessed());
            }
        });
    }

    private void scheduleTakeover(SupportedChain chain, Instant heldUntil) {
        Instant base = heldUntil != null ? heldUntil : clock.instant();
        Instant at = base.plusMillis(TAKEOVER_MARGIN_MS);
        log.info("Backfill on {} is leased until {}; retrying resume at {}", chain, heldUntil, at);
        taskScheduler.schedule(() -> resumeAbandoned(chain), at);
    }

    private void alert(SupportedChain chain, Throwable error) {
        Throwable cause = error.getCause() != null && error instanceof CompletionException
                ? error.getCause() : error;
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", "backfill_failed");
        fields.put("chainId", chain.chainId());
        fields.put("error", cause.getMessage());
        changeNotifier.publish(NotificationChannel.SYSTEM_ALERT, fields);
    }
}
