package com.continuum.relayer.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.continuum.relayer.config.RelayerProperties;
import com.continuum.relayer.domain.enums.LedgerOrderStatus;
import com.continuum.relayer.domain.enums.OrderStatus;
import com.continuum.relayer.domain.model.ExecutionFailure;
import com.continuum.relayer.domain.model.Order;
import com.continuum.relayer.domain.model.OrderRecord;
import com.continuum.relayer.domain.model.OrderSubmission;
import com.continuum.relayer.event.OrderStateEvent;
import com.continuum.relayer.exception.CancellationRejectedException;
import com.continuum.relayer.exception.DuplicateSubmissionException;
import com.continuum.relayer.exception.ErrorCode;
import com.continuum.relayer.exception.InvalidTransitionException;
import com.continuum.relayer.exception.LedgerException;
import com.continuum.relayer.exception.OrderNotFoundException;
import com.continuum.relayer.exception.OrderRejectedException;
import com.continuum.relayer.ledger.LedgerGateway;
import com.continuum.relayer.notification.NotificationHub;
import com.continuum.relayer.notification.OrderTopic;
import com.continuum.relayer.oms.CancellationVerifier;
import com.continuum.relayer.oms.ExecutionEngine;
import com.continuum.relayer.oms.IdempotencyService;
import com.continuum.relayer.oms.OrderIntakeService;
import com.continuum.relayer.oms.OrderStore;
import com.continuum.relayer.oms.SubmissionReceipt;
import com.continuum.relayer.pool.PoolRegistry;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Unit tests for OrderIntakeService: validation, dedup, user transaction relay,
 * cancellation authorization and the execution time estimate.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OrderIntakeServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private ExecutionEngine executionEngine;

    @Mock
    private LedgerGateway ledgerGateway;

    @Mock
    private CancellationVerifier cancellationVerifier;

    private OrderStore orderStore;
    private List<OrderStateEvent> events;
    private OrderIntakeService intakeService;

    @BeforeEach
    void setUp() {
        RelayerProperties properties = new RelayerProperties();
        properties.getIntake().setMinOrderSize(BigInteger.valueOf(100));
        properties.getIntake().setMaxOrderSize(BigInteger.valueOf(1_000_000));
        properties.getIntake().setFeeLamports(BigInteger.valueOf(5_000));
        properties.getIntake().setDefaultExecutionEstimateMs(4_000);
        RelayerProperties.Pool active = new RelayerProperties.Pool();
        active.setPoolId("PoolX");
        RelayerProperties.Pool paused = new RelayerProperties.Pool();
        paused.setPoolId("PoolPaused");
        paused.setActive(false);
        properties.getPools().add(active);
        properties.getPools().add(paused);

        orderStore = new OrderStore(new IdempotencyService(properties, CLOCK), CLOCK);
        NotificationHub hub = new NotificationHub();
        events = new ArrayList<>();
        hub.subscribe(OrderTopic.GLOBAL, events::add);

        when(executionEngine.averageExecutionTime()).thenReturn(Optional.empty());

        intakeService = new OrderIntakeService(
                orderStore, executionEngine, hub, ledgerGateway, new PoolRegistry(properties), cancellationVerifier, properties);
    }

    private OrderSubmission submission(String poolId, long amountIn, String nonce) {
        return OrderSubmission.builder()
                .userAddress("UserA")
                .poolId(poolId)
                .amountIn(BigInteger.valueOf(amountIn))
                .minAmountOut(BigInteger.valueOf(1))
                .baseInput(true)
                .nonce(nonce)
                .build();
    }

    @Nested
    @DisplayName("Submit")
    class Submit {

        @Test
        @DisplayName("Accepted submission is PENDING, announced and priced")
        void acceptedSubmission() {
            SubmissionReceipt receipt = intakeService.submit(submission("PoolX", 500, "n1"), null);

            assertThat(receipt.getOrder().getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(receipt.getFee()).isEqualTo(BigInteger.valueOf(5_000));
            assertThat(receipt.getEstimatedExecutionTime()).isEqualTo(Duration.ofMillis(4_000));
            assertThat(events).hasSize(1);
            assertThat(events.get(0).getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(events.get(0).getPreviousStatus()).isNull();
            verify(ledgerGateway, never()).broadcast(anyString());
        }

        @Test
        @DisplayName("Duplicate fingerprint is rejected and only one order exists")
        void duplicateRejected() {
            intakeService.submit(submission("PoolX", 500, "n1"), null);

            assertThatThrownBy(() -> intakeService.submit(submission("PoolX", 500, "n1"), null))
                    .isInstanceOf(DuplicateSubmissionException.class);
            assertThat(orderStore.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Unknown or inactive pools are rejected")
        void unsupportedPool() {
            assertThatThrownBy(() -> intakeService.submit(submission("PoolY", 500, "n1"), null))
                    .isInstanceOf(OrderRejectedException.class)
                    .satisfies(e -> assertThat(((OrderRejectedException) e).getErrorCode()).isEqualTo(ErrorCode.POOL_NOT_SUPPORTED));
            assertThatThrownBy(() -> intakeService.submit(submission("PoolPaused", 500, "n1"), null))
                    .isInstanceOf(OrderRejectedException.class);
            assertThat(orderStore.size()).isZero();
        }

        @Test
        @DisplayName("Amounts outside the allowed range are rejected")
        void amountOutOfRange() {
            assertThatThrownBy(() -> intakeService.submit(submission("PoolX", 99, "n1"), null))
                    .isInstanceOf(OrderRejectedException.class)
                    .hasMessageContaining("range");
            assertThatThrownBy(() -> intakeService.submit(submission("PoolX", 1_000_001, "n2"), null))
                    .isInstanceOf(OrderRejectedException.class);
        }

        @Test
        @DisplayName("User transaction is relayed and its signature recorded")
        void userTransactionRelayed() {
            when(ledgerGateway.broadcast("dHg=")).thenReturn("userSig");

            SubmissionReceipt receipt = intakeService.submit(submission("PoolX", 500, "n1"), "dHg=");

            assertThat(receipt.getOrder().getSubmissionSignature()).isEqualTo("userSig");
        }

        @Test
        @DisplayName("Failed relay rejects the submission and frees the nonce")
        void failedRelayFreesNonce() {
            when(ledgerGateway.broadcast("dHg="))
                    .thenThrow(new LedgerException(ExecutionFailure.permanentFailure("Transaction simulation failed")));

            assertThatThrownBy(() -> intakeService.submit(submission("PoolX", 500, "n1"), "dHg="))
                    .isInstanceOf(LedgerException.class);
            assertThat(orderStore.size()).isZero();
            assertThat(events).isEmpty();

            assertThat(intakeService.submit(submission("PoolX", 500, "n1"), null)).isNotNull();
        }

        @Test
        @DisplayName("The order is registered before the relay, so a record landing meanwhile binds to it")
        void recordLandingDuringRelayBindsToIntakeOrder() {
            OrderRecord landed = OrderRecord.builder()
                    .address("OrderAcct9")
                    .sequence(9)
                    .userAddress("UserA")
                    .poolId("PoolX")
                    .amountIn(BigInteger.valueOf(500))
                    .minAmountOut(BigInteger.ONE)
                    .baseInput(true)
                    .status(LedgerOrderStatus.PENDING)
                    .build();
            when(ledgerGateway.broadcast("dHg=")).thenAnswer(invocation -> {
                Order match = orderStore.findUnboundMatch(landed).orElseThrow();
                orderStore.bindSequence(match.getOrderId(), landed.getSequence());
                return "userSig";
            });

            SubmissionReceipt receipt = intakeService.submit(submission("PoolX", 500, "n1"), "dHg=");

            assertThat(orderStore.size()).isEqualTo(1);
            assertThat(receipt.getOrder().getSequence()).isEqualTo(9L);
            assertThat(receipt.getOrder().getSubmissionSignature()).isEqualTo("userSig");
            assertThat(orderStore.findBySequence(9)).map(Order::getOrderId).contains(receipt.getOrder().getOrderId());
        }

        @Test
        @DisplayName("A relay error is not reported once the order is already bound on the ledger")
        void relayErrorAfterLandingKeepsOrder() {
            when(ledgerGateway.broadcast("dHg=")).thenAnswer(invocation -> {
                String orderId = orderStore.findAll().get(0).getOrderId();
                orderStore.bindSequence(orderId, 4);
                throw new LedgerException(ExecutionFailure.transientFailure("Request timed out"));
            });

            SubmissionReceipt receipt = intakeService.submit(submission("PoolX", 500, "n1"), "dHg=");

            assertThat(receipt.getOrder().getSequence()).isEqualTo(4L);
            assertThat(receipt.getOrder().getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(events).hasSize(1);
        }

        @Test
        @DisplayName("Estimate scales with the orders ahead")
        void estimateScalesWithBacklog() {
            when(executionEngine.queueDepth()).thenReturn(2);
            when(executionEngine.inFlightCount()).thenReturn(1);
            when(executionEngine.averageExecutionTime()).thenReturn(Optional.of(Duration.ofMillis(1_500)));

            assertThat(intakeService.estimateExecutionTime()).isEqualTo(Duration.ofMillis(6_000));
        }
    }

    @Nested
    @DisplayName("Cancel and status")
    class CancelAndStatus {

        @Test
        @DisplayName("Missing proof is unauthorized")
        void missingProof() {
            Order order = intakeService.submit(submission("PoolX", 500, "n1"), null).getOrder();

            assertThatThrownBy(() -> intakeService.cancel(order.getOrderId(), " "))
                    .isInstanceOf(CancellationRejectedException.class);
            verify(executionEngine, never()).cancel(anyString());
        }

        @Test
        @DisplayName("Proof not signed by the order owner is unauthorized")
        void invalidProof() {
            Order order = intakeService.submit(submission("PoolX", 500, "n1"), null).getOrder();
            when(cancellationVerifier.verify(order.getOrderId(), "UserA", "forged")).thenReturn(false);

            assertThatThrownBy(() -> intakeService.cancel(order.getOrderId(), "forged"))
                    .isInstanceOf(CancellationRejectedException.class)
                    .hasMessageContaining("Invalid");
            verify(executionEngine, never()).cancel(anyString());
        }

        @Test
        @DisplayName("Valid proof delegates to the engine")
        void validProofCancels() {
            Order order = intakeService.submit(submission("PoolX", 500, "n1"), null).getOrder();
            Order cancelled = order.toBuilder().status(OrderStatus.CANCELLED).build();
            when(cancellationVerifier.verify(any(), any(), any())).thenReturn(true);
            when(executionEngine.cancel(order.getOrderId())).thenReturn(cancelled);

            assertThat(intakeService.cancel(order.getOrderId(), "sig").getStatus()).isEqualTo(OrderStatus.CANCELLED);
        }

        @Test
        @DisplayName("Too-late cancellation surfaces InvalidTransitionException")
        void tooLate() {
            Order order = intakeService.submit(submission("PoolX", 500, "n1"), null).getOrder();
            when(cancellationVerifier.verify(any(), any(), any())).thenReturn(true);
            when(executionEngine.cancel(order.getOrderId()))
                    .thenThrow(new InvalidTransitionException(order.getOrderId(), OrderStatus.EXECUTING, OrderStatus.CANCELLED));

            assertThatThrownBy(() -> intakeService.cancel(order.getOrderId(), "sig"))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("Unknown order id is not found for status and cancel")
        void unknownOrder() {
            assertThatThrownBy(() -> intakeService.status("ord_missing")).isInstanceOf(OrderNotFoundException.class);
            assertThatThrownBy(() -> intakeService.cancel("ord_missing", "sig"))
                    .isInstanceOf(OrderNotFoundException.class);
        }
    }
}
