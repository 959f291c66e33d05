package com.continuum.relayer.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Common tags for every meter, so several relayers reporting to one backend stay apart.
 * The relayer's own meters live in {@link com.continuum.relayer.observability.ExecutionMetrics}.
 */
@Configuration(proxyBeanMethods = false)
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> relayerCommonTags(
            @Value("${spring.application.name:continuum-relayer}") String applicationName,
            RelayerProperties relayerProperties) {
        String programId = relayerProperties.getLedger().getProgramId();
        return registry -> registry.config().commonTags(
                "application", applicationName,
                "program", programId == null ? "unset" : programId);
    }
}
