package com.continuum.relayer.observability;

import com.continuum.relayer.api.websocket.OrderSubscriptionInterceptor;
import com.continuum.relayer.domain.enums.OrderStatus;
import com.continuum.relayer.event.OrderStateEvent;
import com.continuum.relayer.notification.NotificationHub;
import com.continuum.relayer.notification.OrderTopic;
import com.continuum.relayer.oms.ExecutionEngine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Service;

/**
 * Relayer meters, fed by the NotificationHub's global feed.
 *
 * <ul>
 *   <li><b>relayer.orders.executed</b>, <b>relayer.orders.failed</b>, <b>relayer.orders.cancelled</b> (counters)</li>
 *   <li><b>relayer.orders.retried</b> (counter): attempts sent back to PENDING for a retry</li>
 *   <li><b>relayer.execution.latency</b> (timer): first claim to EXECUTED</li>
 *   <li><b>relayer.inflight</b>, <b>relayer.queue.depth</b>, <b>relayer.cursor</b>,
 *       <b>relayer.ws.subscriptions</b> (gauges, read on scrape)</li>
 * </ul>
 */
@Service
public class ExecutionMetrics {

    private final Counter executedCounter;
    private final Counter failedCounter;
    private final Counter cancelledCounter;
    private final Counter retriedCounter;
    private final Timer executionLatency;

    /** orderId -> time of its first EXECUTING transition. */
    private final Map<String, Instant> firstClaimedAt = new ConcurrentHashMap<>();

    public ExecutionMetrics(
            MeterRegistry meterRegistry,
            NotificationHub notificationHub,
            ExecutionEngine executionEngine,
            OrderSubscriptionInterceptor orderSubscriptionInterceptor) {
        this.executedCounter = Counter.builder("relayer.orders.executed")
                .description("Orders confirmed executed on the ledger")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("relayer.orders.failed")
                .description("Orders failed permanently or after exhausting retries")
                .register(meterRegistry);
        this.cancelledCounter = Counter.builder("relayer.orders.cancelled")
                .description("Orders cancelled by users or on the ledger")
                .register(meterRegistry);
        this.retriedCounter = Counter.builder("relayer.orders.retried")
                .description("Failed attempts scheduled for retry")
                .register(meterRegistry);

        this.executionLatency = Timer.builder("relayer.execution.latency")
                .description("Time from first claim to confirmed execution, retries included")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofMinutes(5))
                .register(meterRegistry);

        meterRegistry.gauge("relayer.inflight", executionEngine, ExecutionEngine::inFlightCount);
        meterRegistry.gauge("relayer.queue.depth", executionEngine, ExecutionEngine::queueDepth);
        meterRegistry.gauge("relayer.cursor", executionEngine, ExecutionEngine::cursorPosition);
        meterRegistry.gauge(
                "relayer.ws.subscriptions", orderSubscriptionInterceptor, OrderSubscriptionInterceptor::activeSubscriptionCount);

        notificationHub.subscribe(OrderTopic.GLOBAL, this::onOrderState);
    }

    void onOrderState(OrderStateEvent event) {
        OrderStatus status = event.getStatus();
        switch (status) {
            case EXECUTING -> firstClaimedAt.putIfAbsent(event.getOrderId(), event.getTimestamp());
            case PENDING -> {
                if (event.getPreviousStatus() == OrderStatus.EXECUTING) {
                    retriedCounter.increment();
                }
            }
            case EXECUTED -> {
                executedCounter.increment();
                Instant claimedAt = firstClaimedAt.remove(event.getOrderId());
                if (claimedAt != null && event.getTimestamp() != null) {
                    executionLatency.record(Duration.between(claimedAt, event.getTimestamp()));
                }
            }
            case FAILED -> {
                failedCounter.increment();
                firstClaimedAt.remove(event.getOrderId());
            }
            case CANCELLED -> cancelledCounter.increment();
        }
    }
}
