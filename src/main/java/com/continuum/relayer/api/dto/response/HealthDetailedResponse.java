package com.continuum.relayer.api.dto.response;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Returned by GET /api/health/detailed. */
@Getter
@Builder
public class HealthDetailedResponse {

    /** "UP" or "DEGRADED". */
    private final String status;

    private final Map<String, SubsystemHealth> subsystems;

    @Getter
    @Builder
    public static class SubsystemHealth {
        /** "UP" or "DOWN". */
        private final String status;

        private final String message;
    }
}
