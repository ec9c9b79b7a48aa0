package com.phillippitts.sttpool.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Records pool events into {@link PoolMetrics}, tolerating its absence.
 *
 * <p>The supervisor always talks to a publisher; with no meter registry (tests, or a stripped-down
 * context) it gets {@link #NOOP} and every call returns immediately.
 *
 * @since 1.0
 */
public final class PoolMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(PoolMetricsPublisher.class);

    /**
     * No-op instance for tests and contexts without a meter registry.
     */
    public static final PoolMetricsPublisher NOOP = new PoolMetricsPublisher(null);

    private final PoolMetrics metrics;

    /**
     * @param metrics metrics sink (nullable for test mode)
     */
    public PoolMetricsPublisher(PoolMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("PoolMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records a terminal outcome.
     */
    public void recordOutcome(String kind) {
        if (metrics == null) {
            return;
        }
        metrics.incrementOutcome(kind);
    }

    public void recordCallLatency(long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordCallLatency(durationNanos);
    }

    public void recordQueueWait(long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordQueueWait(durationNanos);
    }

    public void recordRecycled(String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementRecycled(reason);
    }

    /**
     * Records how many units a worker generation completed before leaving the pool.
     */
    public void recordGenerationEnd(int tasksCompleted) {
        if (metrics == null) {
            return;
        }
        metrics.recordWorkerTasks(tasksCompleted);
    }

    public void recordSpawnFailure() {
        if (metrics == null) {
            return;
        }
        metrics.incrementSpawnFailure();
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
