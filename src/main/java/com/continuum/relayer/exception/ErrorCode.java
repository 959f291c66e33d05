package com.continuum.relayer.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    POOL_NOT_SUPPORTED("POOL_NOT_SUPPORTED", 400),
    ORDER_SIZE_OUT_OF_RANGE("ORDER_SIZE_OUT_OF_RANGE", 400),
    UNAUTHORIZED("UNAUTHORIZED", 401),
    ORDER_NOT_FOUND("ORDER_NOT_FOUND", 404),
    NOT_FOUND("NOT_FOUND", 404),
    DUPLICATE_SUBMISSION("DUPLICATE_SUBMISSION", 409),
    INVALID_TRANSITION("INVALID_TRANSITION", 409),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    LEDGER_ERROR("LEDGER_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
