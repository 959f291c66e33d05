package com.continuum.relayer.api.dto.response;

import com.continuum.relayer.domain.enums.OrderStatus;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class CancelOrderResponse {

    private final String orderId;
    private final OrderStatus status;

    /** Always "0": the relayer never holds user funds. */
    private final String refund;
}
