package com.auditra.compliance.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Infrastructure beans for the compliance engine
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ComplianceProperties.class)
public class ComplianceConfiguration {

    /**
     * System clock; tests replace it with a fixed clock for deterministic timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Bounded pool for per-transaction rule evaluation. Closed with the context.
     */
    @Bean(name = "ruleEvaluationExecutor", destroyMethod = "shutdown")
    public ExecutorService ruleEvaluationExecutor(ComplianceProperties properties) {
        int threads = Math.max(1, properties.getEvaluation().getThreads());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "rule-eval-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Rule evaluation executor configured with {} threads", threads);
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}
