package com.phillippitts.sttpool.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class PoolMetricsTest {

    private MeterRegistry registry;
    private PoolMetricsPublisher publisher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        publisher = new PoolMetricsPublisher(new PoolMetrics(registry));
    }

    @Test
    void shouldCountOutcomesByLowercaseKind() {
        publisher.recordOutcome("SUCCESS");
        publisher.recordOutcome("SUCCESS");
        publisher.recordOutcome("WORKER_CRASHED");

        Counter success = registry.find("sttpool.outcomes").tag("kind", "success").counter();
        Counter crashed = registry.find("sttpool.outcomes").tag("kind", "worker_crashed").counter();

        assertThat(success).isNotNull();
        assertThat(success.count()).isEqualTo(2.0);
        assertThat(crashed.count()).isEqualTo(1.0);
    }

    @Test
    void shouldRecordLatencyAndQueueWait() {
        publisher.recordCallLatency(TimeUnit.MILLISECONDS.toNanos(100));
        publisher.recordCallLatency(TimeUnit.MILLISECONDS.toNanos(150));
        publisher.recordQueueWait(TimeUnit.MILLISECONDS.toNanos(20));

        Timer latency = registry.find("sttpool.call.latency").timer();
        Timer wait = registry.find("sttpool.queue.wait").timer();

        assertThat(latency.count()).isEqualTo(2);
        assertThat(latency.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250);
        assertThat(wait.count()).isEqualTo(1);
    }

    @Test
    void shouldTrackGenerationEndings() {
        publisher.recordRecycled("max_tasks");
        publisher.recordRecycled("timeout");
        publisher.recordGenerationEnd(100);
        publisher.recordSpawnFailure();

        assertThat(registry.find("sttpool.workers.recycled").tag("reason", "max_tasks").counter().count())
                .isEqualTo(1.0);
        DistributionSummary tasks = registry.find("sttpool.worker.tasks").summary();
        assertThat(tasks.count()).isEqualTo(1);
        assertThat(tasks.totalAmount()).isEqualTo(100.0);
        assertThat(registry.find("sttpool.workers.spawn.failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    void noopPublisherIgnoresEverything() {
        assertThat(PoolMetricsPublisher.NOOP.isEnabled()).isFalse();
        assertThat(publisher.isEnabled()).isTrue();

        assertThatCode(() -> {
            PoolMetricsPublisher.NOOP.recordOutcome("SUCCESS");
            PoolMetricsPublisher.NOOP.recordCallLatency(1);
            PoolMetricsPublisher.NOOP.recordQueueWait(1);
            PoolMetricsPublisher.NOOP.recordRecycled("idle");
            PoolMetricsPublisher.NOOP.recordGenerationEnd(3);
            PoolMetricsPublisher.NOOP.recordSpawnFailure();
        }).doesNotThrowAnyException();
    }
}
