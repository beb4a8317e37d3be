package com.rebalanceradar.notification;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Application event carrying one change notification to its subscribers.
 */
@Getter
public class ChangeEvent extends ApplicationEvent {

    private final ChangeNotification notification;

    public ChangeEvent(Object source, ChangeNotification notification) {
        super(source);
        this.notification = notification;
    }
}
