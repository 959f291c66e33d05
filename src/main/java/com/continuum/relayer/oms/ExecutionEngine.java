package com.continuum.relayer.oms;

import com.continuum.relayer.config.RelayerProperties;
import com.continuum.relayer.domain.enums.OrderStatus;
import com.continuum.relayer.domain.model.ExecutionFailure;
import com.continuum.relayer.domain.model.ExecutionResult;
import com.continuum.relayer.domain.model.Order;
import com.continuum.relayer.domain.model.OrderRecord;
import com.continuum.relayer.event.OrderStateEvent;
import com.continuum.relayer.exception.InvalidTransitionException;
import com.continuum.relayer.exception.LedgerException;
import com.continuum.relayer.ledger.ExecutionInstruction;
import com.continuum.relayer.ledger.LedgerErrorClassifier;
import com.continuum.relayer.ledger.LedgerGateway;
import com.continuum.relayer.ledger.SignedPayload;
import com.continuum.relayer.ledger.TransactionResult;
import com.continuum.relayer.ledger.TransactionSigner;
import com.continuum.relayer.notification.NotificationHub;
import com.continuum.relayer.pool.PoolRegistry;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * The scheduling loop that drives orders from PENDING to a terminal status in ledger sequence order.
 *
 * <p>One coordinating thread calls {@link #tick()} every poll interval. A tick reads the ledger's
 * current sequence and then, while the {@link ConcurrencyGate} has permits, takes the next piece of
 * work: a queued retry first, otherwise the next undiscovered sequence. The gate is checked before
 * anything is dequeued or fetched, so a full gate never costs an order its place.
 *
 * <p>Attempts (sign, submit, wait for confirmation) run on the execution executor. Their outcomes
 * come back through {@link #completeSuccess} and {@link #completeFailure}. Every mutation of the
 * OrderStore, ExecutionQueue and SequenceCursor happens while holding {@code lock}; ledger reads
 * never do, so completions, cancellations and the read-only views are not held up by a slow RPC.
 *
 * <p>The cursor only advances over contiguous settled sequences: executed, failed for good,
 * cancelled, or skipped because no order exists at that sequence. While an order waits out a retry
 * backoff no later sequence is discovered, so attempts stay in ascending sequence order.
 */
@Component
public class ExecutionEngine implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final LedgerGateway ledgerGateway;
    private final TransactionSigner transactionSigner;
    private final OrderStore orderStore;
    private final ExecutionQueue executionQueue;
    private final ConcurrencyGate concurrencyGate;
    private final RetryPolicy retryPolicy;
    private final NotificationHub notificationHub;
    private final PoolRegistry poolRegistry;
    private final LedgerErrorClassifier errorClassifier;
    private final Executor attemptExecutor;
    private final TaskScheduler retryScheduler;
    private final Clock clock;
    private final Duration pollInterval;
    private final Long configuredStartSequence;

    private final Object tickGuard = new Object();
    private final Object lock = new Object();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Set<String> awaitingRetry = new HashSet<>();
    private final Map<String, Instant> attemptStartedAt = new HashMap<>();
    private final TreeSet<Long> settledAhead = new TreeSet<>();
    private final AtomicLong completedExecutions = new AtomicLong();
    private final AtomicLong totalExecutionMillis = new AtomicLong();

    private volatile SequenceCursor cursor;

    /** Highest sequence already resolved against the ledger. Never behind the cursor. */
    private volatile long discoveryHead;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread loopThread;

    public ExecutionEngine(
            LedgerGateway ledgerGateway,
            TransactionSigner transactionSigner,
            OrderStore orderStore,
            ExecutionQueue executionQueue,
            ConcurrencyGate concurrencyGate,
            RetryPolicy retryPolicy,
            NotificationHub notificationHub,
            PoolRegistry poolRegistry,
            LedgerErrorClassifier errorClassifier,
            @Qualifier("executionExecutor") Executor attemptExecutor,
            @Qualifier("retryScheduler") TaskScheduler retryScheduler,
            Clock clock,
            RelayerProperties relayerProperties) {
        this.ledgerGateway = ledgerGateway;
        this.transactionSigner = transactionSigner;
        this.orderStore = orderStore;
        this.executionQueue = executionQueue;
        this.concurrencyGate = concurrencyGate;
        this.retryPolicy = retryPolicy;
        this.notificationHub = notificationHub;
        this.poolRegistry = poolRegistry;
        this.errorClassifier = errorClassifier;
        this.attemptExecutor = attemptExecutor;
        this.retryScheduler = retryScheduler;
        this.clock = clock;
        this.pollInterval = Duration.ofMillis(relayerProperties.getEngine().getPollIntervalMs());
        this.configuredStartSequence = relayerProperties.getEngine().getStartSequence();
    }

    // ---- Lifecycle ----

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            loopThread = new Thread(this::runLoop, "execution-engine");
            loopThread.setDaemon(true);
            loopThread.start();
            log.info("ExecutionEngine started: pollInterval={}ms, concurrencyLimit={}, maxAttempts={}",
                    pollInterval.toMillis(), concurrencyGate.limit(), retryPolicy.getMaxAttempts());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (loopThread != null) {
                loopThread.interrupt();
            }
            log.info("ExecutionEngine stopping: inFlight={}", inFlightCount());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // After the web server, so intake is reachable before the first tick
        return Integer.MAX_VALUE - 100;
    }

    private void runLoop() {
        while (running.get()) {
            try {
                tick();
            } catch (RuntimeException e) {
                // One bad tick must never stop the loop
                log.error("Engine tick failed", e);
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                if (!running.get()) {
                    log.info("ExecutionEngine interrupted during shutdown");
                    Thread.currentThread().interrupt();
                    break;
                }
                log.warn("ExecutionEngine interrupted unexpectedly, resuming");
            }
        }
    }

    // ---- Scheduling ----

    /** One scheduling pass. Called by the loop thread; public so tests can drive the engine step by step. */
    public void tick() {
        synchronized (tickGuard) {
            if (cursor == null && !initializeCursor()) {
                return;
            }

            long ledgerHead;
            try {
                ledgerHead = ledgerGateway.currentSequence();
            } catch (LedgerException e) {
                log.warn("Could not read ledger sequence: error={}", e.getMessage());
                return;
            }

            synchronized (lock) {
                if (!cursor.observe(ledgerHead)) {
                    return;
                }
            }

            while (concurrencyGate.tryAcquire()) {
                StepOutcome outcome;
                try {
                    outcome = step(ledgerHead);
                } catch (RuntimeException e) {
                    log.error("Engine step failed: cursor={}, discoveryHead={}", cursorPosition(), discoveryHead, e);
                    outcome = StepOutcome.STALLED;
                }
                if (outcome != StepOutcome.LAUNCHED) {
                    concurrencyGate.release();
                }
                if (outcome == StepOutcome.IDLE || outcome == StepOutcome.STALLED) {
                    break;
                }
            }
        }
    }

    /** Seeds the cursor from configuration or, by default, from the ledger's current sequence. */
    private boolean initializeCursor() {
        long start;
        if (configuredStartSequence != null) {
            start = configuredStartSequence;
        } else {
            try {
                start = ledgerGateway.currentSequence();
            } catch (LedgerException e) {
                log.warn("Cannot seed sequence cursor, ledger unavailable: error={}", e.getMessage());
                return false;
            }
        }
        synchronized (lock) {
            discoveryHead = start;
            cursor = new SequenceCursor(start);
        }
        log.info("Sequence cursor initialized: position={}, source={}",
                start, configuredStartSequence != null ? "config" : "ledger");
        return true;
    }

    /**
     * Picks the next piece of work under the lock, fetches its ledger record without it, then
     * applies the result under the lock again. Must be called with a permit held.
     */
    private StepOutcome step(long ledgerHead) {
        String queuedOrderId;
        long sequence;
        synchronized (lock) {
            Optional<String> queued = executionQueue.dequeueNext();
            if (queued.isPresent()) {
                Optional<Order> current = orderStore.get(queued.get());
                if (current.isEmpty() || current.get().getStatus() != OrderStatus.PENDING) {
                    log.debug("Dropping stale queue entry: orderId={}", queued.get());
                    return StepOutcome.PROGRESS;
                }
                queuedOrderId = queued.get();
                sequence = current.get().getSequence();
            } else if (!awaitingRetry.isEmpty()) {
                // Nothing past a sequence in backoff may start
                return StepOutcome.IDLE;
            } else if (discoveryHead < ledgerHead) {
                queuedOrderId = null;
                sequence = discoveryHead + 1;
            } else {
                return StepOutcome.IDLE;
            }
        }

        Optional<OrderRecord> record;
        try {
            record = ledgerGateway.fetchOrder(sequence);
        } catch (LedgerException e) {
            if (queuedOrderId != null) {
                log.warn("Could not refetch order, keeping its place: orderId={}, error={}", queuedOrderId, e.getMessage());
                synchronized (lock) {
                    if (isPending(queuedOrderId)) {
                        executionQueue.restoreToHead(queuedOrderId);
                    }
                }
            } else {
                log.warn("Could not fetch order: sequence={}, error={}", sequence, e.getMessage());
            }
            return StepOutcome.STALLED;
        }

        synchronized (lock) {
            return queuedOrderId != null ? resume(queuedOrderId, sequence, record) : discover(sequence, record);
        }
    }

    private StepOutcome discover(long sequence, Optional<OrderRecord> found) {
        if (!awaitingRetry.isEmpty()) {
            // An attempt failed during the fetch; rediscover this sequence once its retry settles
            log.debug("Discovery deferred behind a retry: sequence={}", sequence);
            return StepOutcome.IDLE;
        }
        discoveryHead = sequence;

        if (found.isEmpty()) {
            log.warn("No order on ledger, skipping sequence: sequence={}", sequence);
            settle(sequence);
            return StepOutcome.PROGRESS;
        }

        OrderRecord record = found.get();
        Order order = bind(record);
        return dispatch(order, record);
    }

    private StepOutcome resume(String orderId, long sequence, Optional<OrderRecord> record) {
        if (!isPending(orderId)) {
            log.debug("Order left PENDING while refetching: orderId={}", orderId);
            return StepOutcome.PROGRESS;
        }
        if (record.isEmpty()) {
            log.warn("Order vanished from ledger: orderId={}, sequence={}", orderId, sequence);
            transition(orderId, OrderStatus.CANCELLED,
                    TransitionPayload.builder().error("Order no longer on ledger").build());
            settle(sequence);
            return StepOutcome.PROGRESS;
        }
        return dispatch(orderStore.get(orderId).orElseThrow(), record.get());
    }

    private boolean isPending(String orderId) {
        return orderStore.get(orderId).map(order -> order.getStatus() == OrderStatus.PENDING).orElse(false);
    }

    /** Links a ledger record to its local order: already bound, a matching intake order, or adopted. */
    private Order bind(OrderRecord record) {
        Optional<Order> bound = orderStore.findBySequence(record.getSequence());
        if (bound.isPresent()) {
            return bound.get();
        }
        Optional<Order> match = orderStore.findUnboundMatch(record);
        if (match.isPresent()) {
            return orderStore.bindSequence(match.get().getOrderId(), record.getSequence());
        }
        Order adopted = orderStore.adopt(record);
        notificationHub.publish(OrderStateEvent.created(adopted));
        return adopted;
    }

    /** Reconciles local state with the ledger record, launching an attempt when the order is still open. */
    private StepOutcome dispatch(Order order, OrderRecord record) {
        long sequence = record.getSequence();
        if (order.getStatus() == OrderStatus.CANCELLED) {
            log.info("Skipping cancelled order: orderId={}, sequence={}", order.getOrderId(), sequence);
            settle(sequence);
            return StepOutcome.PROGRESS;
        }
        if (order.getStatus() != OrderStatus.PENDING) {
            log.warn("Order not dispatchable: orderId={}, status={}", order.getOrderId(), order.getStatus());
            return StepOutcome.PROGRESS;
        }

        switch (record.getStatus()) {
            case PENDING -> {
                launch(order, record);
                return StepOutcome.LAUNCHED;
            }
            case CANCELLED -> {
                log.info("Order cancelled on ledger: orderId={}, sequence={}", order.getOrderId(), sequence);
                transition(order.getOrderId(), OrderStatus.CANCELLED, TransitionPayload.NONE);
            }
            case EXECUTED -> {
                log.info("Order already executed on ledger: orderId={}, sequence={}", order.getOrderId(), sequence);
                transition(order.getOrderId(), OrderStatus.EXECUTING, TransitionPayload.RECONCILED);
                ExecutionResult result = ExecutionResult.builder()
                        .signature(order.getLastSignature())
                        .executedAt(record.getExecutedAt() != null ? record.getExecutedAt() : clock.instant())
                        .build();
                transition(order.getOrderId(), OrderStatus.EXECUTED, TransitionPayload.withResult(result));
            }
            case FAILED -> {
                log.warn("Order marked failed on ledger: orderId={}, sequence={}", order.getOrderId(), sequence);
                transition(order.getOrderId(), OrderStatus.EXECUTING, TransitionPayload.RECONCILED);
                transition(order.getOrderId(), OrderStatus.FAILED,
                        TransitionPayload.withError("Order marked failed on ledger", order.getLastSignature()));
            }
        }
        settle(sequence);
        return StepOutcome.PROGRESS;
    }

    private void launch(Order order, OrderRecord record) {
        String orderId = order.getOrderId();
        Order claimed = transition(orderId, OrderStatus.EXECUTING, TransitionPayload.NONE);
        inFlight.add(orderId);
        attemptStartedAt.put(orderId, clock.instant());

        ExecutionInstruction instruction = ExecutionInstruction.builder()
                .orderId(orderId)
                .sequence(record.getSequence())
                .orderAddress(record.getAddress())
                .userAddress(record.getUserAddress())
                .poolId(record.getPoolId())
                .ammConfig(poolRegistry.find(record.getPoolId()).map(RelayerProperties.Pool::getAmmConfig).orElse(null))
                .amountIn(record.getAmountIn())
                .minAmountOut(record.getMinAmountOut())
                .baseInput(record.isBaseInput())
                .build();

        log.info("Execution attempt launched: orderId={}, sequence={}, attempt={}",
                orderId, record.getSequence(), claimed.getAttempts());
        try {
            attemptExecutor.execute(() -> runAttempt(orderId, instruction));
        } catch (RejectedExecutionException e) {
            completeFailure(orderId, null, ExecutionFailure.transientFailure("Execution pool saturated"));
        }
    }

    /** Runs on the execution executor, outside the lock. */
    private void runAttempt(String orderId, ExecutionInstruction instruction) {
        try {
            SignedPayload payload = transactionSigner.sign(instruction);
            TransactionResult result = ledgerGateway.submit(payload);
            if (result.isConfirmed()) {
                completeSuccess(orderId, result);
            } else {
                ExecutionFailure failure = result.getError() != null
                        ? result.getError()
                        : ExecutionFailure.transientFailure("Transaction not confirmed");
                completeFailure(orderId, result.getSignature(), failure);
            }
        } catch (LedgerException e) {
            completeFailure(orderId, e.getSignature(), e.getFailure());
        } catch (RuntimeException e) {
            log.error("Unexpected error during execution attempt: orderId={}", orderId, e);
            completeFailure(orderId, null, errorClassifier.classify(e.getMessage()));
        }
    }

    void completeSuccess(String orderId, TransactionResult result) {
        synchronized (lock) {
            try {
                Order order = orderStore.get(orderId).orElseThrow();
                Instant now = clock.instant();
                ExecutionResult executionResult = ExecutionResult.builder()
                        .signature(result.getSignature())
                        .actualAmountOut(result.getAmountOut())
                        .effectivePrice(effectivePrice(order, result))
                        .executedAt(now)
                        .build();
                Order executed = transition(orderId, OrderStatus.EXECUTED, TransitionPayload.withResult(executionResult));
                recordExecutionTime(orderId, now);
                log.info("Order executed: orderId={}, sequence={}, attempts={}, signature={}, amountOut={}",
                        orderId, executed.getSequence(), executed.getAttempts(), result.getSignature(), result.getAmountOut());
                settle(executed.getSequence());
            } catch (InvalidTransitionException e) {
                log.warn("Execution result rejected: orderId={}, from={}, to={}", orderId, e.getFrom(), e.getTo());
            } finally {
                finishAttempt(orderId);
            }
        }
    }

    void completeFailure(String orderId, String signature, ExecutionFailure failure) {
        synchronized (lock) {
            try {
                Order order = orderStore.get(orderId).orElseThrow();
                int attempts = order.getAttempts();
                TransitionPayload payload = TransitionPayload.withError(failure.reason(), signature);

                if (retryPolicy.shouldRetry(attempts, failure)) {
                    Duration delay = retryPolicy.delayFor(attempts);
                    Order pending = orderStore.transition(orderId, OrderStatus.PENDING, payload);
                    notificationHub.publish(OrderStateEvent.retryScheduled(pending, delay.toMillis()));
                    log.warn("Execution attempt failed, retrying: orderId={}, attempt={}, delay={}ms, error={}",
                            orderId, attempts, delay.toMillis(), failure.reason());
                    awaitingRetry.add(orderId);
                    retryScheduler.schedule(() -> requeue(orderId), clock.instant().plus(delay));
                } else {
                    Order failed = transition(orderId, OrderStatus.FAILED, payload);
                    log.error("Order failed: orderId={}, sequence={}, attempts={}, kind={}, error={}",
                            orderId, failed.getSequence(), attempts, failure.kind(), failure.reason());
                    settle(failed.getSequence());
                }
            } catch (InvalidTransitionException e) {
                log.warn("Execution failure rejected: orderId={}, from={}, to={}", orderId, e.getFrom(), e.getTo());
            } finally {
                finishAttempt(orderId);
            }
        }
    }

    /** Retry backoff elapsed: put the order back in line unless it was cancelled meanwhile. */
    private void requeue(String orderId) {
        synchronized (lock) {
            awaitingRetry.remove(orderId);
            Optional<Order> order = orderStore.get(orderId);
            if (order.isPresent() && order.get().getStatus() == OrderStatus.PENDING) {
                executionQueue.enqueue(orderId);
                log.debug("Order re-enqueued after backoff: orderId={}", orderId);
            }
        }
    }

    private void finishAttempt(String orderId) {
        if (inFlight.remove(orderId)) {
            attemptStartedAt.remove(orderId);
            concurrencyGate.release();
        }
    }

    // ---- Cancellation ----

    /**
     * Cancels a PENDING order. The order is removed from the queue and its sequence, if known,
     * will not be attempted.
     *
     * @throws InvalidTransitionException if the order already left PENDING
     */
    public Order cancel(String orderId) {
        synchronized (lock) {
            Order cancelled = transition(orderId, OrderStatus.CANCELLED, TransitionPayload.NONE);
            executionQueue.remove(orderId);
            awaitingRetry.remove(orderId);
            if (cancelled.getSequence() != null && cursor != null) {
                settle(cancelled.getSequence());
            }
            log.info("Order cancelled: orderId={}, sequence={}", orderId, cancelled.getSequence());
            return cancelled;
        }
    }

    // ---- Internals ----

    private Order transition(String orderId, OrderStatus next, TransitionPayload payload) {
        OrderStatus previous = orderStore.get(orderId).map(Order::getStatus).orElse(null);
        Order updated = orderStore.transition(orderId, next, payload);
        notificationHub.publish(OrderStateEvent.transitioned(updated, previous));
        return updated;
    }

    /** Marks a sequence terminal and moves the cursor over every contiguous settled sequence. */
    private void settle(long sequence) {
        if (sequence <= cursor.position()) {
            return;
        }
        settledAhead.add(sequence);
        while (settledAhead.remove(cursor.nextExpected())) {
            cursor.advance();
        }
    }

    private void recordExecutionTime(String orderId, Instant finishedAt) {
        Instant startedAt = attemptStartedAt.get(orderId);
        if (startedAt != null) {
            completedExecutions.incrementAndGet();
            totalExecutionMillis.addAndGet(Duration.between(startedAt, finishedAt).toMillis());
        }
    }

    private static BigDecimal effectivePrice(Order order, TransactionResult result) {
        if (result.getAmountOut() == null || order.getAmountIn().signum() == 0) {
            return null;
        }
        return new BigDecimal(result.getAmountOut()).divide(new BigDecimal(order.getAmountIn()), MathContext.DECIMAL64);
    }

    // ---- Read-only views ----

    /** Last settled sequence, or -1 before the cursor is seeded. */
    public long cursorPosition() {
        SequenceCursor current = cursor;
        return current != null ? current.position() : -1;
    }

    /** Ledger sequence seen on the latest tick, or -1 before the cursor is seeded. */
    public long ledgerHead() {
        SequenceCursor current = cursor;
        return current != null ? current.ledgerHead() : -1;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public int queueDepth() {
        return executionQueue.size();
    }

    /** Mean time from claim to confirmed execution, or empty before any execution completed. */
    public Optional<Duration> averageExecutionTime() {
        long count = completedExecutions.get();
        if (count == 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(totalExecutionMillis.get() / count));
    }

    private enum StepOutcome {
        /** An attempt now owns the permit. */
        LAUNCHED,
        /** Work was done without launching; try the next step. */
        PROGRESS,
        /** Nothing left to do this tick. */
        IDLE,
        /** Ledger unavailable; retry next tick. */
        STALLED
    }
}
