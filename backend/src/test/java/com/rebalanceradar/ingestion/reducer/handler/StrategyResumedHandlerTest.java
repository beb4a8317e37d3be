package com.rebalanceradar.ingestion.reducer.handler;

import com.rebalanceradar.domain.StrategyRepository;
import com.rebalanceradar.ingestion.event.ChainEvent.StrategyResumed;
import com.rebalanceradar.ingestion.event.EventMeta;
import com.rebalanceradar.notification.ChangeNotifier;
import com.rebalanceradar.notification.NotificationChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StrategyResumedHandlerTest {

    private static final Instant BLOCK_TIME = Instant.parse("2025-03-04T10:00:00Z");
    private static final String USER = "0x5555555555555555555555555555555555555555";
    private static final String KEY = "84532-" + USER + "-9";

    @Mock
    private StrategyRepository strategyRepository;
    @Mock
    private StrategyLookup strategyLookup;
    @Mock
    private ChangeNotifier changeNotifier;

    private StrategyResumedHandler handler;

    @BeforeEach
    void setUp() {
        handler = new StrategyResumedHandler(strategyRepository, strategyLookup, changeNotifier);
    }

    @Test
    void handle_resumesWithFalseFlagAndEventPosition() {
        when(strategyRepository.applyPauseState(KEY, false, 410_000_001L, BLOCK_TIME)).thenReturn(true);

        handler.handle(resumed(410, 1));

        verify(changeNotifier).publish(eq(NotificationChannel.STRATEGY_RESUMED), anyMap());
        verify(strategyLookup, never()).requireIndexed(any());
    }

    @Test
    void handle_redeliveredThreeTimes_notifiesOnce() {
        StrategyResumed event = resumed(410, 1);
        when(strategyRepository.applyPauseState(KEY, false, 410_000_001L, BLOCK_TIME)).thenReturn(true, false, false);

        handler.handle(event);
        handler.handle(event);
        handler.handle(event);

        verify(changeNotifier, times(1)).publish(eq(NotificationChannel.STRATEGY_RESUMED), anyMap());
    }

    private static StrategyResumed resumed(long block, long logIndex) {
        return new StrategyResumed(new EventMeta(84532L, "0xr" + block, block, logIndex, BLOCK_TIME), USER,
                BigInteger.valueOf(9));
    }
}
