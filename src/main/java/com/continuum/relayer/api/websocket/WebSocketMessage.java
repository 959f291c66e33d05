package com.continuum.relayer.api.websocket;

import com.continuum.relayer.api.dto.response.OrderView;
import com.continuum.relayer.event.OrderStateEvent;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for every STOMP message: {@code {type, orderId, version, data}}.
 *
 * <p>{@code ORDER_UPDATE} carries an {@link OrderStateEvent}, {@code ORDER_SNAPSHOT} an
 * {@link OrderView}. Clients that hold both a snapshot and live updates keep the highest
 * {@code version} per order and drop anything older.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WebSocketMessage {

    public static final String ORDER_UPDATE = "ORDER_UPDATE";
    public static final String ORDER_SNAPSHOT = "ORDER_SNAPSHOT";

    private String type;
    private String orderId;
    private long version;
    private Object data;

    public static WebSocketMessage update(OrderStateEvent event) {
        return new WebSocketMessage(ORDER_UPDATE, event.getOrderId(), event.getVersion(), event);
    }

    public static WebSocketMessage snapshot(OrderView view) {
        return new WebSocketMessage(ORDER_SNAPSHOT, view.getOrderId(), view.getVersion(), view);
    }
}
