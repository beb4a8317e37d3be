package com.rebalanceradar.ingestion.queue;

import com.rebalanceradar.config.AsyncConfig;
import com.rebalanceradar.domain.QueuedEvent;
import com.rebalanceradar.ingestion.config.IngestionQueueProperties;
import com.rebalanceradar.ingestion.event.EventDecodingException;
import com.rebalanceradar.ingestion.reducer.EventReducer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One consumer loop per queue partition on the ingestion executor. Items of a partition are
 * reduced one at a time, so events of the same user never run concurrently.
 */
@Slf4j
@Component
public class IngestionQueueConsumer {

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final IngestionQueue queue;
    private final EventReducer eventReducer;
    private final IngestionQueueProperties properties;
    private final Executor ingestionExecutor;

    public IngestionQueueConsumer(IngestionQueue queue, EventReducer eventReducer, IngestionQueueProperties properties,
                                  @Qualifier(AsyncConfig.INGESTION_EXECUTOR) Executor ingestionExecutor) {
        this.queue = queue;
        this.eventReducer = eventReducer;
        this.properties = properties;
        this.ingestionExecutor = ingestionExecutor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        recoverStaleClaims();
        if (!properties.isConsumersEnabled()) {
            log.info("Ingestion queue consumers disabled");
            return;
        }
        start();
    }

    void start() {
        if (!running.compareAndSet(false, true)) return;
        int partitions = queue.partitions();
        for (int p = 0; p < partitions; p++) {
            int partition = p;
            ingestionExecutor.execute(() -> consumeLoop(partition));
        }
        log.info("Ingestion queue consumer loops started: {}", partitions);
    }

    /** Consumers stop claiming; the item in hand is finished before the loop exits. */
    @PreDestroy
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping ingestion queue consumers");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    void consumeLoop(int partition) {
        while (running.get()) {
            boolean processed;
            try {
                processed = processNext(partition);
            } catch (RuntimeException e) {
                log.error("Queue consumer for partition {} failed: {}", partition, e.getMessage(), e);
                processed = false;
            }
            if (!processed && !pause(properties.getPollIntervalMs())) {
                break;
            }
        }
        log.debug("Queue consumer for partition {} exited", partition);
    }

    /**
     * Claims and reduces the next ready item of the partition.
     *
     * @return false when nothing was ready
     */
    boolean processNext(int partition) {
        Optional<QueuedEvent> claimed = queue.claimNext(partition);
        if (claimed.isEmpty()) {
            return false;
        }
        QueuedEvent item = claimed.get();
        try {
            eventReducer.reduce(IngestionQueue.toRawEvent(item));
            queue.complete(item);
        } catch (EventDecodingException e) {
            queue.fail(item, e, false);
        } catch (RuntimeException e) {
            queue.fail(item, e, true);
        }
        return true;
    }

    @Scheduled(fixedDelayString = "${rebalanceradar.ingestion.queue.stale-recovery-interval-ms:60000}",
            initialDelayString = "${rebalanceradar.ingestion.queue.stale-recovery-interval-ms:60000}")
    public void recoverStaleClaims() {
        try {
            queue.recoverStaleClaims();
        } catch (DataAccessException e) {
            log.warn("Stale claim recovery failed: {}", e.getMessage());
        }
    }

    private static boolean pause(long ms) {
        try {
            Thread.sleep(Math.max(1L, ms));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
