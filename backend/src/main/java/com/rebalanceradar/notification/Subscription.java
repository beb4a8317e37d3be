package com.rebalanceradar.notification;

import org.springframework.context.ApplicationListener;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Listener for one channel, returned by {@link ChangeNotifier#subscribe}; pass it back to unsubscribe.
 */
public final class Subscription implements ApplicationListener<ChangeEvent> {

    private final String id = UUID.randomUUID().toString();
    private final AtomicBoolean active = new AtomicBoolean(true);
    private final NotificationChannel channel;
    private final Consumer<ChangeNotification> handler;

    Subscription(NotificationChannel channel, Consumer<ChangeNotification> handler) {
        this.channel = channel;
        this.handler = handler;
    }

    public String getId() {
        return id;
    }

    public NotificationChannel getChannel() {
        return channel;
    }

    public boolean isActive() {
        return active.get();
    }

    @Override
    public void onApplicationEvent(ChangeEvent event) {
        ChangeNotification notification = event.getNotification();
        if (active.get() && notification.channel() == channel) {
            handler.accept(notification);
        }
    }

    /** @return false if already deactivated */
    boolean deactivate() {
        return active.compareAndSet(true, false);
    }
}
