package com.rebalanceradar.query;

import com.rebalanceradar.domain.DailyStats;
import com.rebalanceradar.domain.DailyStatsRepository;
import com.rebalanceradar.domain.DeadLetterEvent;
import com.rebalanceradar.domain.DeadLetterEventRepository;
import com.rebalanceradar.domain.Rebalance;
import com.rebalanceradar.domain.RebalanceRepository;
import com.rebalanceradar.domain.Strategy;
import com.rebalanceradar.domain.StrategyRepository;
import com.rebalanceradar.domain.SupportedChain;
import com.rebalanceradar.domain.Swap;
import com.rebalanceradar.domain.SwapRepository;
import com.rebalanceradar.domain.SystemEvent;
import com.rebalanceradar.domain.SystemEventRepository;
import com.rebalanceradar.domain.UserAccount;
import com.rebalanceradar.domain.UserAccountRepository;
import com.rebalanceradar.ingestion.queue.IngestionQueue;
import com.rebalanceradar.ingestion.queue.QueueStats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read surface over the canonical state. Addresses may be passed in any case.
 */
@Service
@RequiredArgsConstructor
public class IndexedStateQueryService {

    private final StrategyRepository strategyRepository;
    private final RebalanceRepository rebalanceRepository;
    private final SwapRepository swapRepository;
    private final UserAccountRepository userAccountRepository;
    private final SystemEventRepository systemEventRepository;
    private final DailyStatsRepository dailyStatsRepository;
    private final DeadLetterEventRepository deadLetterEventRepository;
    private final IngestionQueue ingestionQueue;

    public Optional<Strategy> findStrategy(SupportedChain chain, String userAddress, BigInteger strategyId) {
        return strategyRepository.findById(Strategy.key(chain.chainId(), normalize(userAddress), strategyId));
    }

    /**
     * Strategies newest first; both filters optional.
     */
    public List<Strategy> listStrategies(String userAddress, SupportedChain chain) {
        if (userAddress != null && chain != null) {
            return strategyRepository.findByChainIdAndUserAddressOrderByCreatedAtDesc(chain.chainId(), normalize(userAddress));
        }
        if (userAddress != null) {
            return strategyRepository.findByUserAddressOrderByCreatedAtDesc(normalize(userAddress));
        }
        if (chain != null) {
            return strategyRepository.findByChainIdOrderByCreatedAtDesc(chain.chainId());
        }
        return strategyRepository.findAll();
    }

    public List<Rebalance> listRebalances(String strategyKey) {
        return rebalanceRepository.findByStrategyKeyOrderByBlockNumberDescLogIndexDesc(strategyKey);
    }

    public List<Rebalance> listRebalancesByUser(String userAddress, SupportedChain chain) {
        if (chain != null) {
            return rebalanceRepository.findByChainIdAndUserAddressOrderByBlockNumberDesc(chain.chainId(), normalize(userAddress));
        }
        return rebalanceRepository.findByUserAddressOrderByBlockNumberDesc(normalize(userAddress));
    }

    public Optional<Rebalance> findRebalance(String rebalanceId) {
        return rebalanceRepository.findById(rebalanceId);
    }

    /** Swaps of a rebalance in log order. */
    public List<Swap> listSwaps(String rebalanceId) {
        return swapRepository.findByRebalanceIdOrderBySwapIndexAsc(rebalanceId);
    }

    public List<Swap> listSwapsByStrategy(String strategyKey) {
        return swapRepository.findByStrategyKeyOrderByBlockNumberDesc(strategyKey);
    }

    public Optional<UserAccount> findUser(String userAddress) {
        return userAccountRepository.findById(normalize(userAddress));
    }

    public List<SystemEvent> listSystemEvents(SupportedChain chain, SystemEvent.SystemEventType type) {
        if (type != null) {
            return systemEventRepository.findByChainIdAndTypeOrderByBlockNumberDesc(chain.chainId(), type);
        }
        return systemEventRepository.findByChainIdOrderByBlockNumberDescLogIndexDesc(chain.chainId());
    }

    /** Inclusive UTC date range. */
    public List<DailyStats> listDailyStats(SupportedChain chain, LocalDate from, LocalDate to) {
        return dailyStatsRepository.findRange(chain.chainId(), from.toString(), to.toString());
    }

    public List<DeadLetterEvent> listDeadLetters(SupportedChain chain) {
        if (chain != null) {
            return deadLetterEventRepository.findByChainIdOrderByDeadLetteredAtDesc(chain.chainId());
        }
        return deadLetterEventRepository.findAllByOrderByDeadLetteredAtDesc();
    }

    public QueueStats queueStats() {
        return ingestionQueue.stats();
    }

    private static String normalize(String address) {
        return address == null ? null : address.toLowerCase(Locale.ROOT);
    }
}
