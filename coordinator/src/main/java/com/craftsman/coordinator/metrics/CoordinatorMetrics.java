package com.craftsman.coordinator.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for tool calls, delegations and task outcomes.
 *
 * <pre>
 *   craftsman.tool.calls{operation, role, status}
 *   craftsman.tool.duration{operation}
 *   craftsman.delegations{from, to, result}
 *   craftsman.delegation.depth
 *   craftsman.tasks{role, status}
 *   craftsman.task.retries{role}
 * </pre>
 */
@Service
public class CoordinatorMetrics {

    private final MeterRegistry registry;

    public CoordinatorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void recordToolCall(String operation, String role, String status, Timer.Sample sample) {
        if (sample != null) {
            sample.stop(registry.timer("craftsman.tool.duration", "operation", operation));
        }
        Counter.builder("craftsman.tool.calls")
                .tag("operation", operation)
                .tag("role", role)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordDelegation(String from, String to, String result) {
        Counter.builder("craftsman.delegations")
                .tag("from", from)
                .tag("to", to)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordDelegationDepth(int depth) {
        DistributionSummary.builder("craftsman.delegation.depth")
                .register(registry)
                .record(depth);
    }

    public void recordTask(String role, String status) {
        Counter.builder("craftsman.tasks")
                .tag("role", role)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRetry(String role) {
        Counter.builder("craftsman.task.retries")
                .tag("role", role)
                .register(registry)
                .increment();
    }
}
