package com.continuum.relayer.oms;

import com.continuum.relayer.domain.enums.OrderOrigin;
import com.continuum.relayer.domain.enums.OrderStatus;
import com.continuum.relayer.domain.model.Order;
import com.continuum.relayer.domain.model.OrderRecord;
import com.continuum.relayer.domain.model.OrderSubmission;
import com.continuum.relayer.exception.DuplicateSubmissionException;
import com.continuum.relayer.exception.InvalidTransitionException;
import com.continuum.relayer.exception.OrderNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory registry of every order the relayer knows about, keyed by orderId.
 *
 * <p>Orders are never deleted; they live until process restart. All writes go through the
 * synchronized methods below, and every read hands out a snapshot, so callers can never mutate
 * stored state behind the state machine's back.
 */
@Component
public class OrderStore {

    private static final Logger log = LoggerFactory.getLogger(OrderStore.class);

    private final Map<String, Order> orders = new ConcurrentHashMap<>();
    private final Map<Long, String> orderIdsBySequence = new ConcurrentHashMap<>();
    private final IdempotencyService idempotencyService;
    private final Clock clock;

    public OrderStore(IdempotencyService idempotencyService, Clock clock) {
        this.idempotencyService = idempotencyService;
        this.clock = clock;
    }

    /**
     * Accepts a new submission as a PENDING order.
     *
     * @throws DuplicateSubmissionException if the same fingerprint was accepted within the dedup window
     */
    public Order create(OrderSubmission submission) {
        return register(reserve(submission), submission, null);
    }

    /**
     * Claims the submission's fingerprint and allocates an orderId without creating the order yet.
     * Follow with {@link #register}.
     */
    public String reserve(OrderSubmission submission) {
        String orderId = newOrderId();
        idempotencyService.claim(submission.fingerprint(), orderId).ifPresent(existing -> {
            log.warn("Duplicate submission rejected: user={}, pool={}, existingOrderId={}",
                    submission.getUserAddress(), submission.getPoolId(), existing);
            throw new DuplicateSubmissionException(submission.fingerprint(), existing);
        });
        return orderId;
    }

    public synchronized Order register(String orderId, OrderSubmission submission, String submissionSignature) {
        Instant now = clock.instant();
        Order order = Order.builder()
                .orderId(orderId)
                .poolId(submission.getPoolId())
                .amountIn(submission.getAmountIn())
                .minAmountOut(submission.getMinAmountOut())
                .baseInput(submission.isBaseInput())
                .userAddress(submission.getUserAddress())
                .fingerprint(submission.fingerprint())
                .origin(OrderOrigin.INTAKE)
                .status(OrderStatus.PENDING)
                .submissionSignature(submissionSignature)
                .createdAt(now)
                .updatedAt(now)
                .build();
        orders.put(orderId, order);
        log.info("Order created: orderId={}, user={}, pool={}, amountIn={}",
                orderId, order.getUserAddress(), order.getPoolId(), order.getAmountIn());
        return order.snapshot();
    }

    /**
     * Removes a registered intake order that never reached the ledger and frees its fingerprint.
     * Refused once the engine has bound the order to a sequence or moved it out of PENDING.
     *
     * @return true if the order was removed
     */
    public synchronized boolean withdraw(String orderId, OrderSubmission submission) {
        Order order = orders.get(orderId);
        if (order == null) {
            return false;
        }
        if (order.getSequence() != null || order.getStatus() != OrderStatus.PENDING) {
            log.warn("Order already on ledger, not withdrawn: orderId={}, sequence={}, status={}",
                    orderId, order.getSequence(), order.getStatus());
            return false;
        }
        orders.remove(orderId);
        idempotencyService.release(submission.fingerprint(), orderId);
        log.info("Order withdrawn: orderId={}", orderId);
        return true;
    }

    public synchronized Order recordSubmissionSignature(String orderId, String submissionSignature) {
        Order order = require(orderId);
        order.setSubmissionSignature(submissionSignature);
        order.setUpdatedAt(clock.instant());
        return order.snapshot();
    }

    /** Registers an order found on-ledger that was not submitted through this relayer. */
    public synchronized Order adopt(OrderRecord record) {
        Instant now = clock.instant();
        Order order = Order.builder()
                .orderId(newOrderId())
                .sequence(record.getSequence())
                .poolId(record.getPoolId())
                .amountIn(record.getAmountIn())
                .minAmountOut(record.getMinAmountOut())
                .baseInput(record.isBaseInput())
                .userAddress(record.getUserAddress())
                .origin(OrderOrigin.LEDGER)
                .status(OrderStatus.PENDING)
                .createdAt(record.getSubmittedAt() != null ? record.getSubmittedAt() : now)
                .updatedAt(now)
                .build();
        orders.put(order.getOrderId(), order);
        orderIdsBySequence.put(record.getSequence(), order.getOrderId());
        log.info("Ledger order adopted: orderId={}, sequence={}, user={}",
                order.getOrderId(), record.getSequence(), record.getUserAddress());
        return order.snapshot();
    }

    /**
     * Finds the intake order a ledger record belongs to: the earliest-created order with no
     * sequence yet whose swap parameters match. Cancelled orders are included so the engine can
     * skip their sequence; terminal orders that already own a sequence never match.
     */
    public synchronized Optional<Order> findUnboundMatch(OrderRecord record) {
        return orders.values().stream()
                .filter(order -> order.getSequence() == null)
                .filter(order -> order.getStatus() == OrderStatus.PENDING || order.getStatus() == OrderStatus.CANCELLED)
                .filter(record::matches)
                .min(Comparator.comparing(Order::getCreatedAt).thenComparing(Order::getOrderId))
                .map(Order::snapshot);
    }

    public synchronized Order bindSequence(String orderId, long sequence) {
        Order order = require(orderId);
        if (order.getSequence() != null && order.getSequence() != sequence) {
            throw new IllegalStateException(String.format(
                    "Order %s already bound to sequence %d, cannot rebind to %d", orderId, order.getSequence(), sequence));
        }
        order.setSequence(sequence);
        order.setUpdatedAt(clock.instant());
        orderIdsBySequence.put(sequence, orderId);
        log.debug("Order bound to sequence: orderId={}, sequence={}", orderId, sequence);
        return order.snapshot();
    }

    public Optional<Order> get(String orderId) {
        Order order = orders.get(orderId);
        if (order == null) {
            return Optional.empty();
        }
        synchronized (this) {
            return Optional.of(order.snapshot());
        }
    }

    public Optional<Order> findBySequence(long sequence) {
        String orderId = orderIdsBySequence.get(sequence);
        return orderId != null ? get(orderId) : Optional.empty();
    }

    /**
     * Moves an order to {@code next}, recording the payload. Entering EXECUTING counts an attempt
     * unless the payload marks the move as a reconciliation with an outcome already on the ledger.
     *
     * @throws InvalidTransitionException if the lifecycle does not allow the move
     * @throws OrderNotFoundException if the order is unknown
     */
    public synchronized Order transition(String orderId, OrderStatus next, TransitionPayload payload) {
        Order order = require(orderId);
        OrderStatus current = order.getStatus();
        if (!current.canTransitionTo(next)) {
            throw new InvalidTransitionException(orderId, current, next);
        }

        order.setStatus(next);
        if (next == OrderStatus.EXECUTING && !payload.isReconciled()) {
            order.setAttempts(order.getAttempts() + 1);
        }
        if (payload.getResult() != null) {
            order.setResult(payload.getResult());
        }
        if (payload.getError() != null) {
            order.setError(payload.getError());
        }
        if (payload.getSignature() != null) {
            order.setLastSignature(payload.getSignature());
        }
        order.setVersion(order.getVersion() + 1);
        order.setUpdatedAt(clock.instant());

        log.debug("Order transitioned: orderId={}, {} -> {}, attempts={}", orderId, current, next, order.getAttempts());
        return order.snapshot();
    }

    public List<Order> findAll() {
        synchronized (this) {
            return orders.values().stream().map(Order::snapshot).toList();
        }
    }

    public synchronized Map<OrderStatus, Long> countByStatus() {
        Map<OrderStatus, Long> counts = new EnumMap<>(OrderStatus.class);
        for (OrderStatus status : OrderStatus.values()) {
            counts.put(status, 0L);
        }
        orders.values().forEach(order -> counts.merge(order.getStatus(), 1L, Long::sum));
        return counts;
    }

    public int size() {
        return orders.size();
    }

    private Order require(String orderId) {
        Order order = orders.get(orderId);
        if (order == null) {
            throw new OrderNotFoundException(orderId);
        }
        return order;
    }

    private static String newOrderId() {
        return "ord_" + UUID.randomUUID().toString().replace("-", "");
    }
}
