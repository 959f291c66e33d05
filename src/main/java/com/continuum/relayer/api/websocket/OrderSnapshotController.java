package com.continuum.relayer.api.websocket;

import com.continuum.relayer.api.dto.response.OrderView;
import com.continuum.relayer.oms.OrderIntakeService;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.simp.annotation.SubscribeMapping;
import org.springframework.stereotype.Controller;

/**
 * Answers a subscription to {@code /app/orders/{orderId}} with the order's current state, once.
 * Clients subscribe here and to {@code /topic/orders/{orderId}} together so that a transition
 * made before the live subscription existed is never missed.
 */
@Controller
public class OrderSnapshotController {

    private final OrderIntakeService orderIntakeService;

    public OrderSnapshotController(OrderIntakeService orderIntakeService) {
        this.orderIntakeService = orderIntakeService;
    }

    @SubscribeMapping("/orders/{orderId}")
    public WebSocketMessage snapshot(@DestinationVariable String orderId) {
        return WebSocketMessage.snapshot(OrderView.from(orderIntakeService.status(orderId)));
    }
}
