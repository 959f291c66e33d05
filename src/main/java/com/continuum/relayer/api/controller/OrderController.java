package com.continuum.relayer.api.controller;

import com.continuum.relayer.api.dto.request.SubmitOrderRequest;
import com.continuum.relayer.api.dto.response.CancelOrderResponse;
import com.continuum.relayer.api.dto.response.OrderView;
import com.continuum.relayer.api.dto.response.SubmitOrderResponse;
import com.continuum.relayer.domain.model.Order;
import com.continuum.relayer.domain.model.OrderSubmission;
import com.continuum.relayer.oms.OrderIntakeService;
import com.continuum.relayer.oms.SubmissionReceipt;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Order intake endpoints.
 *
 * <ul>
 *   <li>POST /api/v1/orders -- submit a swap order</li>
 *   <li>GET /api/v1/orders/{orderId} -- current status</li>
 *   <li>DELETE /api/v1/orders/{orderId} -- cancel while still PENDING; needs {@code Authorization: Bearer <signature>}</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/orders")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final OrderIntakeService orderIntakeService;

    public OrderController(OrderIntakeService orderIntakeService) {
        this.orderIntakeService = orderIntakeService;
    }

    @PostMapping
    public ResponseEntity<SubmitOrderResponse> submitOrder(@Valid @RequestBody SubmitOrderRequest request) {
        log.info("Order submission: user={}, pool={}, amountIn={}, baseInput={}",
                request.getUserAddress(), request.getPoolId(), request.getAmountIn(), request.isBaseInput());

        OrderSubmission submission = OrderSubmission.builder()
                .userAddress(request.getUserAddress())
                .poolId(request.getPoolId())
                .amountIn(request.getAmountIn())
                .minAmountOut(request.getMinAmountOut())
                .baseInput(request.isBaseInput())
                .nonce(request.getNonce())
                .build();

        SubmissionReceipt receipt = orderIntakeService.submit(submission, request.getTransaction());
        Order order = receipt.getOrder();

        return ResponseEntity.ok(SubmitOrderResponse.builder()
                .orderId(order.getOrderId())
                .status(order.getStatus())
                .submissionSignature(order.getSubmissionSignature())
                .estimatedExecutionTimeMs(receipt.getEstimatedExecutionTime().toMillis())
                .fee(receipt.getFee().toString())
                .build());
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderView> getOrder(@PathVariable String orderId) {
        return ResponseEntity.ok(OrderView.from(orderIntakeService.status(orderId)));
    }

    @DeleteMapping("/{orderId}")
    public ResponseEntity<CancelOrderResponse> cancelOrder(
            @PathVariable String orderId, @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        String proof = authorization.startsWith(BEARER_PREFIX)
                ? authorization.substring(BEARER_PREFIX.length()).trim()
                : authorization.trim();

        log.info("Cancelling order {}", orderId);
        Order cancelled = orderIntakeService.cancel(orderId, proof);

        return ResponseEntity.ok(CancelOrderResponse.builder()
                .orderId(cancelled.getOrderId())
                .status(cancelled.getStatus())
                .refund("0")
                .build());
    }
}
