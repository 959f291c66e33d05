package com.continuum.relayer.api.dto.response;

import com.continuum.relayer.domain.enums.OrderStatus;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class SubmitOrderResponse {

    private final String orderId;
    private final OrderStatus status;

    /** Signature of the broadcast user transaction, when one was supplied. */
    private final String submissionSignature;

    private final long estimatedExecutionTimeMs;

    /** Relayer fee in lamports, as a decimal string. */
    private final String fee;
}
