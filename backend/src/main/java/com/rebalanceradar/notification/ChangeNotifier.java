package com.rebalanceradar.notification;

import com.rebalanceradar.config.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.SimpleApplicationEventMulticaster;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Publish/subscribe for indexed state changes over a dedicated event multicaster. Every subscriber
 * is invoked as its own task on the notifier executor, and the multicaster's error handler logs
 * whatever a subscriber throws, so a failing or slow subscriber never affects ingestion or other
 * subscribers. The multicaster is separate from the application context's own so that changes are
 * never delivered on the reducer thread.
 */
@Slf4j
@Component
public class ChangeNotifier {

    private final SimpleApplicationEventMulticaster multicaster;
    private final Clock clock;

    public ChangeNotifier(@Qualifier(AsyncConfig.NOTIFIER_EXECUTOR) Executor notifierExecutor) {
        this(notifierExecutor, Clock.systemUTC());
    }

    ChangeNotifier(Executor notifierExecutor, Clock clock) {
        this.multicaster = new SimpleApplicationEventMulticaster();
        this.multicaster.setTaskExecutor(notifierExecutor);
        this.multicaster.setErrorHandler(e -> log.warn("Change subscriber failed: {}", e.getMessage(), e));
        this.clock = clock;
    }

    public Subscription subscribe(NotificationChannel channel, Consumer<ChangeNotification> handler) {
        Subscription subscription = new Subscription(channel, handler);
        multicaster.addApplicationListener(subscription);
        log.debug("Subscribed {} to {}", subscription.getId(), channel.channelName());
        return subscription;
    }

    /**
     * @return false if the handle was not (or no longer) subscribed
     */
    public boolean unsubscribe(Subscription subscription) {
        if (!subscription.deactivate()) {
            return false;
        }
        multicaster.removeApplicationListener(subscription);
        return true;
    }

    public void publish(NotificationChannel channel, Map<String, Object> fields) {
        ChangeNotification notification = new ChangeNotification(channel, Instant.now(clock), ChangeNotification.SOURCE, fields);
        try {
            multicaster.multicastEvent(new ChangeEvent(this, notification));
        } catch (TaskRejectedException e) {
            log.warn("Dropped {} notification: notifier queue full", channel.channelName());
        }
    }
}
