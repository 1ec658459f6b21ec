package com.foreman.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the task queue, agent lifecycle and project state.
 */
@Service
public class ForemanMetrics {

    private final MeterRegistry registry;

    public ForemanMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Task queue ---

    public void recordTaskEnqueued(String agentType) {
        Counter.builder("foreman.queue.enqueued")
                .tag("agent", agentType != null ? agentType : "unknown")
                .register(registry)
                .increment();
    }

    public void recordTaskDequeued(String agentType) {
        Counter.builder("foreman.queue.dequeued")
                .tag("agent", agentType != null ? agentType : "unknown")
                .register(registry)
                .increment();
    }

    public void recordTaskCancelled() {
        Counter.builder("foreman.queue.cancelled")
                .register(registry)
                .increment();
    }

    /**
     * Records the queue depth observed after a mutation.
     *
     * @param depth number of tasks still waiting
     */
    public void recordQueueDepth(int depth) {
        DistributionSummary.builder("foreman.queue.depth")
                .description("Pending tasks observed after each queue mutation")
                .register(registry)
                .record(depth);
    }

    // --- Agent lifecycle ---

    public void recordLifecycleNotification(String state) {
        Counter.builder("foreman.agent.notifications")
                .tag("state", state)
                .register(registry)
                .increment();
    }

    // --- Project state ---

    public void recordStateWrite(String changeType, long ms) {
        Timer.builder("foreman.state.write.duration")
                .tag("change_type", changeType)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStateConflict() {
        Counter.builder("foreman.state.conflicts")
                .description("Optimistic concurrency conflicts on project state updates")
                .register(registry)
                .increment();
    }

    /**
     * Records a rollback request.
     *
     * @param selector "transaction", "snapshot" or "timestamp"
     * @param success  whether the rollback was applied
     */
    public void recordRollback(String selector, boolean success) {
        Counter.builder("foreman.state.rollbacks")
                .tag("selector", selector)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("foreman.state.cache.lookups")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }
}
