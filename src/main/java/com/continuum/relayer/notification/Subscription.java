package com.continuum.relayer.notification;

import com.continuum.relayer.event.OrderStateEvent;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;

/**
 * Handle returned by {@link NotificationHub#subscribe}. Also remembers the last version seen
 * per order so the same transition is never delivered to this subscriber twice.
 */
@Getter
public final class Subscription {

    private final long id;
    private final OrderTopic topic;
    private final OrderStateListener listener;
    private final Map<String, Long> lastDeliveredVersion = new ConcurrentHashMap<>();

    Subscription(long id, OrderTopic topic, OrderStateListener listener) {
        this.id = id;
        this.topic = topic;
        this.listener = listener;
    }

    /** Claims delivery of the event; false if this or a later version was already delivered. */
    boolean claim(OrderStateEvent event) {
        boolean[] fresh = {false};
        lastDeliveredVersion.compute(event.getOrderId(), (orderId, previous) -> {
            if (previous != null && previous >= event.getVersion()) {
                return previous;
            }
            fresh[0] = true;
            return event.getVersion();
        });
        return fresh[0];
    }

    @Override
    public String toString() {
        return "Subscription{id=" + id + ", topic=" + topic + "}";
    }
}
