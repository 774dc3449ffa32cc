package com.example.redaction.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires configuration properties, the clock and the bounded worker pool used for per-page layout analysis.
 */
@Configuration
@EnableConfigurationProperties(RedactionProperties.class)
public class RedactionConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "layoutExecutor", destroyMethod = "shutdownNow")
    public ExecutorService layoutExecutor(RedactionProperties properties) {
        return newLayoutExecutor(properties.layout().effectiveWorkerThreads());
    }

    /**
     * Creates the fixed-size daemon pool shared by layout analysis runs.
     *
     * @param threads pool size
     * @return executor service; callers own its shutdown
     */
    public static ExecutorService newLayoutExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "layout-analysis-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, threads), factory);
    }
}
