package com.continuum.relayer.notification;

import com.continuum.relayer.event.OrderStateEvent;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fans out order state transitions to topic subscribers.
 *
 * <p>Delivery is synchronous on the notifying thread, best-effort and at-most-once per
 * subscriber per transition. There is no replay: a subscriber that arrives after a transition
 * has to read the current state from the OrderStore. A listener that throws is logged and
 * skipped; it never affects other subscribers or the notifier.
 */
@Component
public class NotificationHub {

    private static final Logger log = LoggerFactory.getLogger(NotificationHub.class);

    private final Map<OrderTopic, List<Subscription>> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    public Subscription subscribe(OrderTopic topic, OrderStateListener listener) {
        Subscription subscription = new Subscription(nextId.getAndIncrement(), topic, listener);
        subscriptions.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(subscription);
        log.debug("Subscribed: {}", subscription);
        return subscription;
    }

    public boolean unsubscribe(Subscription subscription) {
        List<Subscription> topicSubscriptions = subscriptions.get(subscription.getTopic());
        if (topicSubscriptions == null || !topicSubscriptions.remove(subscription)) {
            return false;
        }
        subscriptions.computeIfPresent(subscription.getTopic(), (t, list) -> list.isEmpty() ? null : list);
        log.debug("Unsubscribed: {}", subscription);
        return true;
    }

    /** Delivers the event to every current subscriber of {@code topic}. */
    public void notify(OrderTopic topic, OrderStateEvent event) {
        List<Subscription> topicSubscriptions = subscriptions.get(topic);
        if (topicSubscriptions == null) {
            return;
        }
        for (Subscription subscription : topicSubscriptions) {
            if (!subscription.claim(event)) {
                continue;
            }
            try {
                subscription.getListener().onOrderState(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber failed: {}, orderId={}, status={}",
                        subscription, event.getOrderId(), event.getStatus(), e);
            }
        }
    }

    /** Delivers to the order's own topic, then to the global feed. */
    public void publish(OrderStateEvent event) {
        notify(OrderTopic.forOrder(event.getOrderId()), event);
        notify(OrderTopic.GLOBAL, event);
    }

    public int subscriberCount(OrderTopic topic) {
        List<Subscription> topicSubscriptions = subscriptions.get(topic);
        return topicSubscriptions != null ? topicSubscriptions.size() : 0;
    }
}
