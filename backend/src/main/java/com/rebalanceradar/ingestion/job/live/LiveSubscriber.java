package com.rebalanceradar.ingestion.job.live;

import com.rebalanceradar.domain.ChainIndexState;
import com.rebalanceradar.domain.ChainIndexStateRepository;
import com.rebalanceradar.domain.SupportedChain;
import com.rebalanceradar.ingestion.adapter.ChainClient;
import com.rebalanceradar.ingestion.adapter.ContractEventSource;
import com.rebalanceradar.ingestion.config.BackfillProperties;
import com.rebalanceradar.ingestion.config.IngestionChainProperties;
import com.rebalanceradar.ingestion.config.LiveSubscriberProperties;
import com.rebalanceradar.ingestion.event.RawChainEvent;
import com.rebalanceradar.ingestion.queue.IngestionQueue;
import com.rebalanceradar.notification.ChangeNotifier;
import com.rebalanceradar.notification.NotificationChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Follows new blocks of every live-enabled chain by polling the head. After a restart the
 * subscription continues after the persisted liveBlock, so blocks that arrived while the process was
 * down are fetched too; a chain with no live history starts above the head seen on the first poll
 * and leaves older blocks to the backfill scanner. Logs seen twice are absorbed by the queue key and
 * the reducer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LiveSubscriber {

    private final Map<SupportedChain, Long> cursors = new ConcurrentHashMap<>();
    private final Map<SupportedChain, BigInteger> lastGasPrice = new ConcurrentHashMap<>();

    private final ContractEventSource eventSource;
    private final ChainClient chainClient;
    private final IngestionQueue queue;
    private final ChainIndexStateRepository stateRepository;
    private final IngestionChainProperties chainProperties;
    private final LiveSubscriberProperties liveProperties;
    private final BackfillProperties backfillProperties;
    private final ChangeNotifier changeNotifier;

    @Scheduled(fixedDelayString = "${rebalanceradar.ingestion.live.poll-interval-ms:3000}")
    public void poll() {
        if (!liveProperties.isEnabled()) return;
        for (SupportedChain chain : chainProperties.configuredChains()) {
            if (!chainProperties.require(chain).isLiveEnabled()) continue;
            try {
                pollChain(chain);
            } catch (RuntimeException e) {
                log.warn("Live poll of {} failed, retrying next tick: {}", chain, e.getMessage());
            }
        }
    }

    /**
     * @return events enqueued by this poll
     */
    int pollChain(SupportedChain chain) {
        long safeHead = chainClient.getLatestBlock(chain) - Math.max(0, liveProperties.getConfirmations());
        Long cursor = cursors.get(chain);
        if (cursor == null) {
            cursor = stateRepository.findById(chain.chainId()).map(ChainIndexState::getLiveBlock).orElse(null);
            if (cursor != null) {
                cursors.put(chain, cursor);
                log.info("Live subscription on {} resumes after block {} (head {})", chain, cursor, safeHead);
            }
        }
        if (cursor == null) {
            cursors.put(chain, safeHead);
            stateRepository.recordLiveBlock(chain.chainId(), safeHead);
            log.info("Live subscription on {} starts above block {}", chain, safeHead);
            publishGasPrice(chain);
            return 0;
        }
        int enqueued = 0;
        if (safeHead > cursor) {
            long window = windowSize(chain);
            for (long start = cursor + 1; start <= safeHead; start += window) {
                long end = Math.min(safeHead, start + window - 1);
                List<RawChainEvent> events = eventSource.fetchEvents(chain, start, end);
                for (RawChainEvent event : events) {
                    if (queue.enqueue(event)) {
                        enqueued++;
                    }
                }
                cursors.put(chain, end);
                stateRepository.recordLiveBlock(chain.chainId(), end);
            }
            if (enqueued > 0) {
                log.debug("Live {} blocks {}-{}: {} new event(s)", chain, cursor + 1, safeHead, enqueued);
            }
        }
        publishGasPrice(chain);
        return enqueued;
    }

    Long cursor(SupportedChain chain) {
        return cursors.get(chain);
    }

    private long windowSize(SupportedChain chain) {
        Integer override = chainProperties.require(chain).getBatchBlockSize();
        return Math.max(1, override != null ? override : backfillProperties.getBatchBlockSize());
    }

    private void publishGasPrice(SupportedChain chain) {
        if (!liveProperties.isPublishGasPrice()) return;
        BigInteger price;
        try {
            price = chainClient.getGasPrice(chain);
        } catch (RuntimeException e) {
            log.debug("Gas price unavailable on {}: {}", chain, e.getMessage());
            return;
        }
        BigInteger previous = lastGasPrice.put(chain, price);
        if (price.equals(previous)) return;
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("chainId", chain.chainId());
        fields.put("gasPriceWei", price.toString());
        fields.put("previousGasPriceWei", previous != null ? previous.toString() : null);
        changeNotifier.publish(NotificationChannel.GAS_UPDATED, fields);
    }
}
