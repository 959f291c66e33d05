package com.continuum.relayer.api.websocket;

import com.continuum.relayer.oms.OrderStore;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Guards STOMP SUBSCRIBE frames for {@code /topic/orders/{orderId}} and tracks live order
 * subscriptions per session.
 *
 * <p>Subscribing to an unknown order is rejected with an ERROR frame. UNSUBSCRIBE frames only
 * carry the subscription id, hence the session map. Sessions that drop without a DISCONNECT
 * frame are cleaned up from the {@link SessionDisconnectEvent}.
 */
@Component
public class OrderSubscriptionInterceptor implements ChannelInterceptor {

    private static final Logger log = LoggerFactory.getLogger(OrderSubscriptionInterceptor.class);

    private final OrderStore orderStore;

    /** sessionId -> (subscriptionId -> orderId). */
    private final Map<String, Map<String, String>> sessionSubscriptions = new ConcurrentHashMap<>();

    public OrderSubscriptionInterceptor(OrderStore orderStore) {
        this.orderStore = orderStore;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(message);
        StompCommand command = accessor.getCommand();
        if (command == null) {
            return message;
        }

        switch (command) {
            case SUBSCRIBE -> handleSubscribe(accessor);
            case UNSUBSCRIBE -> handleUnsubscribe(accessor);
            case DISCONNECT -> {
                String sessionId = accessor.getSessionId();
                if (sessionId != null) {
                    handleDisconnect(sessionId);
                }
            }
            default -> {
                // other frames pass through
            }
        }
        return message;
    }

    private void handleSubscribe(StompHeaderAccessor accessor) {
        String destination = accessor.getDestination();
        if (destination == null || !destination.startsWith(OrderUpdatesPublisher.ORDER_TOPIC_PREFIX)) {
            return;
        }

        String orderId = destination.substring(OrderUpdatesPublisher.ORDER_TOPIC_PREFIX.length());
        if (orderId.isBlank() || orderStore.get(orderId).isEmpty()) {
            log.warn("STOMP SUBSCRIBE rejected: session={}, destination={}", accessor.getSessionId(), destination);
            throw new MessageDeliveryException("Unknown order: " + orderId);
        }

        String sessionId = accessor.getSessionId();
        String subscriptionId = accessor.getSubscriptionId();
        if (sessionId == null || subscriptionId == null) {
            return;
        }
        sessionSubscriptions
                .computeIfAbsent(sessionId, k -> new ConcurrentHashMap<>())
                .put(subscriptionId, orderId);
        log.debug("STOMP SUBSCRIBE: session={}, orderId={}", sessionId, orderId);
    }

    private void handleUnsubscribe(StompHeaderAccessor accessor) {
        String sessionId = accessor.getSessionId();
        String subscriptionId = accessor.getSubscriptionId();
        if (sessionId == null || subscriptionId == null) {
            return;
        }

        Map<String, String> subscriptions = sessionSubscriptions.get(sessionId);
        if (subscriptions == null) {
            return;
        }
        String orderId = subscriptions.remove(subscriptionId);
        if (subscriptions.isEmpty()) {
            sessionSubscriptions.remove(sessionId);
        }
        if (orderId != null) {
            log.debug("STOMP UNSUBSCRIBE: session={}, orderId={}", sessionId, orderId);
        }
    }

    @EventListener
    public void onSessionDisconnect(SessionDisconnectEvent event) {
        handleDisconnect(event.getSessionId());
    }

    /** Drops every subscription of the session. Idempotent. */
    public void handleDisconnect(String sessionId) {
        Map<String, String> subscriptions = sessionSubscriptions.remove(sessionId);
        if (subscriptions != null && !subscriptions.isEmpty()) {
            log.info("STOMP DISCONNECT: session={}, cleaned up {} order subscriptions", sessionId, subscriptions.size());
        }
    }

    public int activeSubscriptionCount() {
        return sessionSubscriptions.values().stream().mapToInt(Map::size).sum();
    }
}
