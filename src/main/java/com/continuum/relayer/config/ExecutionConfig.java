package com.continuum.relayer.config;

import com.continuum.relayer.oms.ConcurrencyGate;
import com.continuum.relayer.oms.RetryPolicy;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/** Wires the engine's collaborators that are plain objects rather than components. */
@Configuration
public class ExecutionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConcurrencyGate concurrencyGate(RelayerProperties relayerProperties) {
        return new ConcurrencyGate(relayerProperties.getEngine().getMaxConcurrentExecutions());
    }

    @Bean
    public RetryPolicy retryPolicy(RelayerProperties relayerProperties) {
        RelayerProperties.Retry retry = relayerProperties.getRetry();
        return new RetryPolicy(
                retry.getMaxAttempts(),
                Duration.ofMillis(retry.getBaseDelayMs()),
                retry.getMultiplier(),
                Duration.ofMillis(retry.getMaxDelayMs()));
    }

    /**
     * Runs execution attempts. Sized to the concurrency limit: the gate already bounds submissions,
     * so a rejection here means a permit leaked and is surfaced as a transient failure.
     */
    @Bean("executionExecutor")
    public ThreadPoolTaskExecutor executionExecutor(RelayerProperties relayerProperties) {
        int limit = relayerProperties.getEngine().getMaxConcurrentExecutions();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(limit);
        executor.setMaxPoolSize(limit);
        executor.setQueueCapacity(limit);
        executor.setThreadNamePrefix("execution-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }

    /** Fires retry re-enqueues once their backoff has elapsed. */
    @Bean("retryScheduler")
    public ThreadPoolTaskScheduler retryScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("retry-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
