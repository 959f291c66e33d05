package com.continuum.relayer.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the relayer's own exceptions. The {@link ErrorCode} decides the HTTP status in
 * {@link GlobalExceptionHandler}; {@code details} are echoed to the client as-is, so they must
 * never carry signatures of pending user transactions or key material.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public boolean isClientError() {
        return errorCode.getHttpStatus() < 500;
    }
}
