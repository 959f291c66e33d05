package com.continuum.relayer.api.websocket;

import com.continuum.relayer.event.OrderStateEvent;
import com.continuum.relayer.notification.NotificationHub;
import com.continuum.relayer.notification.OrderTopic;
import com.continuum.relayer.notification.Subscription;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Bridges the NotificationHub's global feed to STOMP. Every transition goes to
 * {@code /topic/orders/{orderId}} and {@code /topic/feed}.
 */
@Component
public class OrderUpdatesPublisher {

    private static final Logger log = LoggerFactory.getLogger(OrderUpdatesPublisher.class);

    public static final String ORDER_TOPIC_PREFIX = "/topic/orders/";
    public static final String FEED_TOPIC = "/topic/feed";

    private final NotificationHub notificationHub;
    private final SimpMessagingTemplate simpMessagingTemplate;
    private Subscription subscription;

    public OrderUpdatesPublisher(NotificationHub notificationHub, SimpMessagingTemplate simpMessagingTemplate) {
        this.notificationHub = notificationHub;
        this.simpMessagingTemplate = simpMessagingTemplate;
    }

    @PostConstruct
    public void subscribe() {
        subscription = notificationHub.subscribe(OrderTopic.GLOBAL, this::onOrderState);
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) {
            notificationHub.unsubscribe(subscription);
        }
    }

    void onOrderState(OrderStateEvent event) {
        WebSocketMessage message = WebSocketMessage.update(event);
        try {
            simpMessagingTemplate.convertAndSend(ORDER_TOPIC_PREFIX + event.getOrderId(), message);
            simpMessagingTemplate.convertAndSend(FEED_TOPIC, message);
        } catch (Exception e) {
            log.error("Failed to send order update via WebSocket: orderId={}, error={}", event.getOrderId(), e.getMessage());
        }
    }
}
