package com.continuum.relayer.api.controller;

import com.continuum.relayer.api.dto.response.PoolResponse;
import com.continuum.relayer.api.dto.response.RelayerInfoResponse;
import com.continuum.relayer.config.RelayerProperties;
import com.continuum.relayer.ledger.TransactionSigner;
import com.continuum.relayer.oms.RelayerStatistics;
import com.continuum.relayer.oms.StatisticsService;
import com.continuum.relayer.pool.PoolRegistry;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Relayer metadata: identity and limits, supported pools, running statistics. */
@RestController
@RequestMapping("/api/v1")
public class RelayerController {

    private final RelayerProperties relayerProperties;
    private final PoolRegistry poolRegistry;
    private final StatisticsService statisticsService;
    private final TransactionSigner transactionSigner;

    public RelayerController(
            RelayerProperties relayerProperties,
            PoolRegistry poolRegistry,
            StatisticsService statisticsService,
            TransactionSigner transactionSigner) {
        this.relayerProperties = relayerProperties;
        this.poolRegistry = poolRegistry;
        this.statisticsService = statisticsService;
        this.transactionSigner = transactionSigner;
    }

    @GetMapping("/info")
    public ResponseEntity<RelayerInfoResponse> info() {
        RelayerProperties.Intake intake = relayerProperties.getIntake();
        RelayerStatistics stats = statisticsService.collect();

        return ResponseEntity.ok(RelayerInfoResponse.builder()
                .relayerAddress(transactionSigner.address())
                .programId(relayerProperties.getLedger().getProgramId())
                .fee(intake.getFeeLamports().toString())
                .relayerFeeBps(intake.getRelayerFeeBps())
                .minOrderSize(intake.getMinOrderSize().toString())
                .maxOrderSize(intake.getMaxOrderSize().toString())
                .supportedPools(pools())
                .performance(RelayerInfoResponse.Performance.builder()
                        .successRate(stats.getSuccessRate())
                        .averageExecutionTimeMs(stats.getAverageExecutionTimeMs())
                        .totalOrders(stats.getTotalOrders())
                        .build())
                .build());
    }

    @GetMapping("/pools")
    public ResponseEntity<List<PoolResponse>> supportedPools() {
        return ResponseEntity.ok(pools());
    }

    @GetMapping("/stats")
    public ResponseEntity<RelayerStatistics> stats() {
        return ResponseEntity.ok(statisticsService.collect());
    }

    private List<PoolResponse> pools() {
        return poolRegistry.findAll().stream()
                .filter(RelayerProperties.Pool::isActive)
                .map(PoolResponse::from)
                .toList();
    }
}
