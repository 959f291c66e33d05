package com.continuum.relayer.notification;

import com.continuum.relayer.event.OrderStateEvent;

@FunctionalInterface
public interface OrderStateListener {

    void onOrderState(OrderStateEvent event);
}
