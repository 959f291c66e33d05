package com.continuum.relayer.exception;

import java.util.Map;
import lombok.Getter;

/**
 * The cancel request for an order carried no proof, or a proof that does not verify against the
 * order's user key. The order is left untouched.
 */
@Getter
public class CancellationRejectedException extends BaseException {

    private final String orderId;

    public CancellationRejectedException(String orderId, String reason) {
        super(ErrorCode.UNAUTHORIZED, reason, Map.of("orderId", orderId));
        this.orderId = orderId;
    }
}
