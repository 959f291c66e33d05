package com.continuum.relayer.oms;

import lombok.Builder;
import lombok.Value;

/** Point-in-time totals for the stats and info endpoints. */
@Value
@Builder
public class RelayerStatistics {

    long totalOrders;
    long pendingOrders;
    long executingOrders;
    long executedOrders;
    long failedOrders;
    long cancelledOrders;

    /** executed / (executed + failed); 1.0 before anything finished. */
    double successRate;

    long averageExecutionTimeMs;
    int queueDepth;
    int inFlight;
    long cursor;
    long ledgerHead;
}
