package io.github.drompincen.remedyguard.gateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools for the gate and the batch orchestrator. The generation pool must be at
 * least as large as the batch parallelism, or queued calls eat into their own timeout.
 */
@Configuration
public class RuntimeConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService generationExecutor(@Value("${remedyguard.generation.threads:8}") int threads) {
        var factory = new CustomizableThreadFactory("generation-");
        factory.setDaemon(true);
        return Executors.newFixedThreadPool(threads, factory);
    }

    @Bean(destroyMethod = "shutdown")
    ExecutorService batchExecutor(@Value("${remedyguard.batch.parallelism:4}") int parallelism) {
        var factory = new CustomizableThreadFactory("batch-");
        factory.setDaemon(true);
        return Executors.newFixedThreadPool(parallelism, factory);
    }
}
