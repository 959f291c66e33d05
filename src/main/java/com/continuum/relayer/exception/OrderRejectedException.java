package com.continuum.relayer.exception;

import java.util.Map;

/** A submission the relayer will not accept: unsupported pool or amount outside the configured range. */
public class OrderRejectedException extends BaseException {

    public OrderRejectedException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
