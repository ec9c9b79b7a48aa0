package com.phillippitts.sttpool.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized Micrometer instrumentation for the worker pool.
 *
 * <p>Provides:
 * <ul>
 *   <li>{@code sttpool.outcomes{kind}} - terminal outcomes by kind</li>
 *   <li>{@code sttpool.call.latency} - time a worker spent on a dispatched unit</li>
 *   <li>{@code sttpool.queue.wait} - time spent queued for a free worker</li>
 *   <li>{@code sttpool.workers.recycled{reason}} - ended worker generations by reason</li>
 *   <li>{@code sttpool.worker.tasks} - units completed per worker generation</li>
 *   <li>{@code sttpool.workers.spawn.failures} - failed process launches and early exits</li>
 * </ul>
 *
 * <p>Pool-size gauges are bound separately from a live snapshot. All metrics are available at
 * /actuator/prometheus.
 */
public class PoolMetrics {

    static final String METRIC_PREFIX = "sttpool";

    private final MeterRegistry registry;

    public PoolMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementOutcome(String kind) {
        Counter.builder(METRIC_PREFIX + ".outcomes")
                .description("Terminal outcomes of submitted units")
                .tag("kind", kind.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordCallLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".call.latency")
                .description("Time from dispatch to outcome on a worker")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordQueueWait(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".queue.wait")
                .description("Time spent waiting for a free worker")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementRecycled(String reason) {
        Counter.builder(METRIC_PREFIX + ".workers.recycled")
                .description("Worker generations ended, by reason")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordWorkerTasks(int tasksCompleted) {
        DistributionSummary.builder(METRIC_PREFIX + ".worker.tasks")
                .description("Units completed by a worker generation before it ended")
                .register(registry)
                .record(tasksCompleted);
    }

    public void incrementSpawnFailure() {
        Counter.builder(METRIC_PREFIX + ".workers.spawn.failures")
                .description("Worker processes that failed to start or exited before ready")
                .register(registry)
                .increment();
    }
}
