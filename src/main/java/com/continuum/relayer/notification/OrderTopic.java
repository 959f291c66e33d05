package com.continuum.relayer.notification;

import java.util.Objects;

/**
 * A NotificationHub topic: either one order's updates or the global feed of all transitions.
 */
public record OrderTopic(String orderId) {

    /** Every transition of every order. */
    public static final OrderTopic GLOBAL = new OrderTopic(null);

    public static OrderTopic forOrder(String orderId) {
        return new OrderTopic(Objects.requireNonNull(orderId, "orderId"));
    }

    public boolean isGlobal() {
        return orderId == null;
    }

    @Override
    public String toString() {
        return isGlobal() ? "feed" : "orders/" + orderId;
    }
}
