package com.continuum.relayer.unit.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.continuum.relayer.api.websocket.OrderSubscriptionInterceptor;
import com.continuum.relayer.domain.model.Order;
import com.continuum.relayer.oms.OrderStore;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@ExtendWith(MockitoExtension.class)
class OrderSubscriptionInterceptorTest {

    @Mock
    private OrderStore orderStore;

    @Mock
    private MessageChannel channel;

    private OrderSubscriptionInterceptor interceptor;

    @BeforeEach
    void setUp() {
        interceptor = new OrderSubscriptionInterceptor(orderStore);
    }

    private static Message<byte[]> frame(StompCommand command, String sessionId, String subscriptionId, String destination) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(command);
        accessor.setSessionId(sessionId);
        if (subscriptionId != null) {
            accessor.setSubscriptionId(subscriptionId);
        }
        if (destination != null) {
            accessor.setDestination(destination);
        }
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }

    private void knownOrder(String orderId) {
        when(orderStore.get(orderId)).thenReturn(Optional.of(Order.builder().orderId(orderId).build()));
    }

    @Test
    @DisplayName("SUBSCRIBE to a known order is tracked")
    void subscribeKnownOrder() {
        knownOrder("ord_1");

        Message<byte[]> message = frame(StompCommand.SUBSCRIBE, "s1", "sub-0", "/topic/orders/ord_1");

        assertThat(interceptor.preSend(message, channel)).isSameAs(message);
        assertThat(interceptor.activeSubscriptionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("SUBSCRIBE to an unknown order is rejected")
    void subscribeUnknownOrder() {
        when(orderStore.get("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> interceptor.preSend(
                        frame(StompCommand.SUBSCRIBE, "s1", "sub-0", "/topic/orders/ghost"), channel))
                .isInstanceOf(MessageDeliveryException.class)
                .hasMessageContaining("ghost");
        assertThat(interceptor.activeSubscriptionCount()).isZero();
    }

    @Test
    @DisplayName("SUBSCRIBE to the feed passes through untracked")
    void subscribeFeed() {
        interceptor.preSend(frame(StompCommand.SUBSCRIBE, "s1", "sub-0", "/topic/feed"), channel);

        assertThat(interceptor.activeSubscriptionCount()).isZero();
    }

    @Test
    @DisplayName("UNSUBSCRIBE removes only that subscription")
    void unsubscribe() {
        knownOrder("ord_1");
        knownOrder("ord_2");
        interceptor.preSend(frame(StompCommand.SUBSCRIBE, "s1", "sub-0", "/topic/orders/ord_1"), channel);
        interceptor.preSend(frame(StompCommand.SUBSCRIBE, "s1", "sub-1", "/topic/orders/ord_2"), channel);

        interceptor.preSend(frame(StompCommand.UNSUBSCRIBE, "s1", "sub-0", null), channel);

        assertThat(interceptor.activeSubscriptionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("DISCONNECT drops every subscription of the session and is idempotent")
    void disconnect() {
        knownOrder("ord_1");
        interceptor.preSend(frame(StompCommand.SUBSCRIBE, "s1", "sub-0", "/topic/orders/ord_1"), channel);
        interceptor.preSend(frame(StompCommand.SUBSCRIBE, "s2", "sub-0", "/topic/orders/ord_1"), channel);

        interceptor.preSend(frame(StompCommand.DISCONNECT, "s1", null, null), channel);
        interceptor.handleDisconnect("s1");

        assertThat(interceptor.activeSubscriptionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("session dropped without DISCONNECT is cleaned up from the disconnect event")
    void abruptDisconnect() {
        knownOrder("ord_1");
        interceptor.preSend(frame(StompCommand.SUBSCRIBE, "s1", "sub-0", "/topic/orders/ord_1"), channel);

        interceptor.onSessionDisconnect(new SessionDisconnectEvent(
                this, frame(StompCommand.DISCONNECT, "s1", null, null), "s1", CloseStatus.GOING_AWAY));

        assertThat(interceptor.activeSubscriptionCount()).isZero();
    }
}
