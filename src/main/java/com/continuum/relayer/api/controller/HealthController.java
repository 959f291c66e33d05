package com.continuum.relayer.api.controller;

import com.continuum.relayer.api.dto.response.HealthDetailedResponse;
import com.continuum.relayer.exception.LedgerException;
import com.continuum.relayer.ledger.LedgerGateway;
import com.continuum.relayer.oms.ExecutionEngine;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health endpoints.
 *
 * <ul>
 *   <li>GET /api/health -- shallow, always 200 while the app responds</li>
 *   <li>GET /api/health/detailed -- engine loop and ledger reachability</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final ExecutionEngine executionEngine;
    private final LedgerGateway ledgerGateway;

    public HealthController(ExecutionEngine executionEngine, LedgerGateway ledgerGateway) {
        this.executionEngine = executionEngine;
        this.ledgerGateway = ledgerGateway;
    }

    @GetMapping
    public ResponseEntity<Map<String, String>> shallowHealth() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    @GetMapping("/detailed")
    public ResponseEntity<HealthDetailedResponse> detailedHealth() {
        Map<String, HealthDetailedResponse.SubsystemHealth> subsystems = new LinkedHashMap<>();

        boolean engineRunning = executionEngine.isRunning();
        subsystems.put("engine", HealthDetailedResponse.SubsystemHealth.builder()
                .status(engineRunning ? "UP" : "DOWN")
                .message(engineRunning
                        ? "cursor=" + executionEngine.cursorPosition() + ", inFlight=" + executionEngine.inFlightCount()
                        : "Scheduling loop not running")
                .build());

        HealthDetailedResponse.SubsystemHealth ledger;
        try {
            long head = ledgerGateway.currentSequence();
            ledger = HealthDetailedResponse.SubsystemHealth.builder()
                    .status("UP")
                    .message("currentSequence=" + head)
                    .build();
        } catch (LedgerException e) {
            ledger = HealthDetailedResponse.SubsystemHealth.builder()
                    .status("DOWN")
                    .message(e.getMessage())
                    .build();
        }
        subsystems.put("ledger", ledger);

        boolean anyDown = subsystems.values().stream().anyMatch(s -> "DOWN".equals(s.getStatus()));
        return ResponseEntity.ok(HealthDetailedResponse.builder()
                .status(anyDown ? "DEGRADED" : "UP")
                .subsystems(subsystems)
                .build());
    }
}
