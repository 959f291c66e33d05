package com.continuum.relayer.api.dto.response;

import com.continuum.relayer.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Failure body: {@code {"success": false, "error": "<reason>", "code": "...", ...}}.
 * {@code error} is a plain string so wallet clients can show it directly.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"success", "error", "code", "details", "path", "timestamp"})
public class ApiErrorResponse {

    boolean success;
    String error;
    String code;
    Map<String, Object> details;
    String path;
    Instant timestamp;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return ApiErrorResponse.builder()
                .success(false)
                .error(message)
                .code(errorCode.getCode())
                .details(details)
                .path(path)
                .timestamp(Instant.now())
                .build();
    }
}
