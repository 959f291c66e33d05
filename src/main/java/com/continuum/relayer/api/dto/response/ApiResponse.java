package com.continuum.relayer.api.dto.response;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Success body of every {@code /api} endpoint: {@code {"success": true, "data": ..., "timestamp": ...}}.
 * Controllers return plain DTOs; {@link com.continuum.relayer.config.ApiResponseAdvice} wraps them.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonPropertyOrder({"success", "data", "timestamp"})
public class ApiResponse<T> {

    boolean success;
    T data;
    Instant timestamp;

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
