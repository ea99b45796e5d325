package com.foreman.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for task scheduling.
 */
@Service
public class ForemanMetrics {

    private final MeterRegistry registry;

    public ForemanMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String owner, long ms) {
        Timer.builder("foreman.task.duration")
                .tag("owner", owner)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "completed", "failed", "timeout", "blocked" or "cancelled"
     */
    public void recordTaskOutcome(String outcome) {
        Counter.builder("foreman.task.outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementRetries(String owner) {
        Counter.builder("foreman.task.retries")
                .tag("owner", owner)
                .register(registry)
                .increment();
    }

    public void recordRunResult(String status) {
        Counter.builder("foreman.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordPasses(int passes) {
        DistributionSummary.builder("foreman.scheduler.passes")
                .description("Scheduling passes per run")
                .register(registry)
                .record(passes);
    }

    public void incrementDeadlockBreaks(String action) {
        Counter.builder("foreman.scheduler.deadlock_breaks")
                .description("Stuck tasks forced forward or blocked by the deadlock breaker")
                .tag("action", action)
                .register(registry)
                .increment();
    }
}
