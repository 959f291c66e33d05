package com.continuum.relayer.api.dto.response;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Returned by GET /api/v1/info: who this relayer is and what it accepts. */
@Getter
@Builder
public class RelayerInfoResponse {

    private final String relayerAddress;
    private final String programId;
    private final String fee;
    private final int relayerFeeBps;
    private final String minOrderSize;
    private final String maxOrderSize;
    private final List<PoolResponse> supportedPools;
    private final Performance performance;

    @Getter
    @Builder
    public static class Performance {
        private final double successRate;
        private final long averageExecutionTimeMs;
        private final long totalOrders;
    }
}
