package com.continuum.relayer.oms;

import com.continuum.relayer.domain.enums.OrderStatus;
import java.time.Duration;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class StatisticsService {

    private final OrderStore orderStore;
    private final ExecutionEngine executionEngine;

    public StatisticsService(OrderStore orderStore, ExecutionEngine executionEngine) {
        this.orderStore = orderStore;
        this.executionEngine = executionEngine;
    }

    public RelayerStatistics collect() {
        Map<OrderStatus, Long> counts = orderStore.countByStatus();
        long executed = counts.get(OrderStatus.EXECUTED);
        long failed = counts.get(OrderStatus.FAILED);
        long finished = executed + failed;

        return RelayerStatistics.builder()
                .totalOrders(orderStore.size())
                .pendingOrders(counts.get(OrderStatus.PENDING))
                .executingOrders(counts.get(OrderStatus.EXECUTING))
                .executedOrders(executed)
                .failedOrders(failed)
                .cancelledOrders(counts.get(OrderStatus.CANCELLED))
                .successRate(finished == 0 ? 1.0 : (double) executed / finished)
                .averageExecutionTimeMs(executionEngine.averageExecutionTime().map(Duration::toMillis).orElse(0L))
                .queueDepth(executionEngine.queueDepth())
                .inFlight(executionEngine.inFlightCount())
                .cursor(executionEngine.cursorPosition())
                .ledgerHead(executionEngine.ledgerHead())
                .build();
    }
}
