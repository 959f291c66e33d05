package com.continuum.relayer.config;

import com.continuum.relayer.api.websocket.OrderSubscriptionInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over {@code /ws}. Live updates on {@code /topic/orders/{orderId}} and {@code /topic/feed};
 * one-off snapshots on {@code /app/orders/{orderId}}.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${relayer.cors.allowed-origin:*}")
    private String allowedOrigin;

    private final OrderSubscriptionInterceptor orderSubscriptionInterceptor;

    public WebSocketConfig(OrderSubscriptionInterceptor orderSubscriptionInterceptor) {
        this.orderSubscriptionInterceptor = orderSubscriptionInterceptor;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws").setAllowedOriginPatterns(allowedOrigin);
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(orderSubscriptionInterceptor);
    }
}
