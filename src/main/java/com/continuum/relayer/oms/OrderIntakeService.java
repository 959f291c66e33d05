package com.continuum.relayer.oms;

import com.continuum.relayer.config.RelayerProperties;
import com.continuum.relayer.domain.model.Order;
import com.continuum.relayer.domain.model.OrderSubmission;
import com.continuum.relayer.event.OrderStateEvent;
import com.continuum.relayer.exception.CancellationRejectedException;
import com.continuum.relayer.exception.ErrorCode;
import com.continuum.relayer.exception.LedgerException;
import com.continuum.relayer.exception.OrderNotFoundException;
import com.continuum.relayer.exception.OrderRejectedException;
import com.continuum.relayer.ledger.LedgerGateway;
import com.continuum.relayer.notification.NotificationHub;
import com.continuum.relayer.pool.PoolRegistry;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for user requests: submit, cancel and status.
 *
 * <p>Submission validates the pool and order size, registers the order as PENDING and then, when
 * one is supplied, relays the user's own signed transaction to the ledger. The engine picks it up once the
 * settlement program has assigned it a sequence.
 */
@Service
public class OrderIntakeService {

    private static final Logger log = LoggerFactory.getLogger(OrderIntakeService.class);

    private final OrderStore orderStore;
    private final ExecutionEngine executionEngine;
    private final NotificationHub notificationHub;
    private final LedgerGateway ledgerGateway;
    private final PoolRegistry poolRegistry;
    private final CancellationVerifier cancellationVerifier;
    private final RelayerProperties.Intake intake;

    public OrderIntakeService(
            OrderStore orderStore,
            ExecutionEngine executionEngine,
            NotificationHub notificationHub,
            LedgerGateway ledgerGateway,
            PoolRegistry poolRegistry,
            CancellationVerifier cancellationVerifier,
            RelayerProperties relayerProperties) {
        this.orderStore = orderStore;
        this.executionEngine = executionEngine;
        this.notificationHub = notificationHub;
        this.ledgerGateway = ledgerGateway;
        this.poolRegistry = poolRegistry;
        this.cancellationVerifier = cancellationVerifier;
        this.intake = relayerProperties.getIntake();
    }

    /**
     * Accepts a submission.
     *
     * @param userTransaction the user's signed submit transaction (base64), or null if the user
     *     submits on-ledger themselves
     * @throws com.continuum.relayer.exception.DuplicateSubmissionException on a repeated fingerprint
     * @throws LedgerException if the user transaction could not be broadcast
     */
    public SubmissionReceipt submit(OrderSubmission submission, String userTransaction) {
        validate(submission);

        String orderId = orderStore.reserve(submission);
        // Registered before the broadcast so the engine binds the ledger record to this order
        Order order = orderStore.register(orderId, submission, null);
        if (userTransaction != null && !userTransaction.isBlank()) {
            order = broadcast(order, submission, userTransaction);
        }
        notificationHub.publish(OrderStateEvent.created(order));

        return SubmissionReceipt.builder()
                .order(order)
                .estimatedExecutionTime(estimateExecutionTime())
                .fee(intake.getFeeLamports())
                .build();
    }

    /** Relays the user's transaction; on failure the just-registered order is withdrawn. */
    private Order broadcast(Order order, OrderSubmission submission, String userTransaction) {
        String orderId = order.getOrderId();
        try {
            String submissionSignature = ledgerGateway.broadcast(userTransaction);
            return orderStore.recordSubmissionSignature(orderId, submissionSignature);
        } catch (LedgerException e) {
            if (orderStore.withdraw(orderId, submission)) {
                log.warn("User transaction broadcast failed: user={}, pool={}, error={}",
                        submission.getUserAddress(), submission.getPoolId(), e.getMessage());
                throw e;
            }
            log.warn("Broadcast reported failure but the order is already on the ledger: orderId={}, error={}",
                    orderId, e.getMessage());
            return status(orderId);
        }
    }

    /**
     * Cancels a PENDING order on behalf of its owner.
     *
     * @param proof base64 ed25519 signature of {@code "Cancel order <orderId>"} by the order's user key
     * @throws CancellationRejectedException if the proof is missing or does not verify
     * @throws com.continuum.relayer.exception.InvalidTransitionException if the engine already claimed the order
     */
    public Order cancel(String orderId, String proof) {
        if (proof == null || proof.isBlank()) {
            throw new CancellationRejectedException(orderId, "Cancellation requires a signature");
        }
        Order order = status(orderId);
        if (!cancellationVerifier.verify(orderId, order.getUserAddress(), proof)) {
            log.warn("Cancellation proof rejected: orderId={}, user={}", orderId, order.getUserAddress());
            throw new CancellationRejectedException(orderId, "Invalid cancellation signature");
        }
        return executionEngine.cancel(orderId);
    }

    public Order status(String orderId) {
        return orderStore.get(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    /** Orders ahead (queued and in flight) plus this one, times the mean execution time. */
    public Duration estimateExecutionTime() {
        long ahead = (long) executionEngine.queueDepth() + executionEngine.inFlightCount();
        Duration perOrder = executionEngine
                .averageExecutionTime()
                .orElse(Duration.ofMillis(intake.getDefaultExecutionEstimateMs()));
        return perOrder.multipliedBy(ahead + 1);
    }

    private void validate(OrderSubmission submission) {
        if (!poolRegistry.isSupported(submission.getPoolId())) {
            throw new OrderRejectedException(
                    ErrorCode.POOL_NOT_SUPPORTED,
                    "Pool not supported: " + submission.getPoolId(),
                    Map.of("poolId", submission.getPoolId()));
        }
        BigInteger amountIn = submission.getAmountIn();
        if (amountIn.compareTo(intake.getMinOrderSize()) < 0 || amountIn.compareTo(intake.getMaxOrderSize()) > 0) {
            throw new OrderRejectedException(
                    ErrorCode.ORDER_SIZE_OUT_OF_RANGE,
                    "amountIn outside allowed range",
                    Map.of("min", intake.getMinOrderSize().toString(), "max", intake.getMaxOrderSize().toString()));
        }
    }
}
