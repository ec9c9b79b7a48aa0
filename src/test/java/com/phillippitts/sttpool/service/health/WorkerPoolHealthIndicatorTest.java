package com.phillippitts.sttpool.service.health;

import com.phillippitts.sttpool.pool.PoolSnapshot;
import com.phillippitts.sttpool.pool.PoolSupervisor;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WorkerPoolHealthIndicatorTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static PoolSnapshot snapshot(boolean shuttingDown, int live, Instant lastSpawnFailure) {
        return new PoolSnapshot(true, shuttingDown, 4, live, 0, live, 0, 0, 2,
                10, 1, 1, 0, 0, 0, lastSpawnFailure == null ? 0 : 1, lastSpawnFailure, List.of(), -1L);
    }

    private static Health healthOf(PoolSnapshot snapshot) {
        PoolSupervisor supervisor = mock(PoolSupervisor.class);
        when(supervisor.snapshot()).thenReturn(snapshot);
        return new WorkerPoolHealthIndicator(supervisor, CLOCK).health();
    }

    @Test
    void shouldReportUpWithPoolDetails() {
        Health health = healthOf(snapshot(false, 2, null));

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("status", "Accepting work")
                .containsEntry("maxWorkers", 4)
                .containsEntry("liveWorkers", 2)
                .containsEntry("queueDepth", 2)
                .containsEntry("crashes", 1L);
    }

    @Test
    void shouldReportDegradedWhenSpawnsFailWithNoLiveWorkers() {
        Health health = healthOf(snapshot(false, 0, NOW.minusSeconds(30)));

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("status", "Worker processes failing to start");
    }

    @Test
    void shouldIgnoreOldOrCoveredSpawnFailures() {
        assertThat(healthOf(snapshot(false, 0, NOW.minus(WorkerPoolHealthIndicator.SPAWN_FAILURE_WINDOW)
                .minusSeconds(1))).getStatus()).isEqualTo(Status.UP);
        assertThat(healthOf(snapshot(false, 1, NOW.minusSeconds(30))).getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void shouldReportDownWhileShuttingDown() {
        assertThat(healthOf(snapshot(true, 1, null)).getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void shouldReportDisabledWhenPoolSwitchedOff() {
        Health health = healthOf(PoolSnapshot.disabled(4));

        assertThat(health.getStatus()).isEqualTo(new Status("DISABLED"));
        assertThat(health.getDetails()).doesNotContainKey("liveWorkers");
    }
}
