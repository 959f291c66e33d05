package com.continuum.relayer.exception;

import java.util.Map;
import lombok.Getter;

/** No order with this id is known to the relayer. Orders are kept until restart, never evicted. */
@Getter
public class OrderNotFoundException extends BaseException {

    private final String orderId;

    public OrderNotFoundException(String orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "Order not found: " + orderId, Map.of("orderId", orderId));
        this.orderId = orderId;
    }
}
