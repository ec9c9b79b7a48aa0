package com.phillippitts.sttpool.service.health;

import com.phillippitts.sttpool.pool.PoolSnapshot;
import com.phillippitts.sttpool.pool.PoolSupervisor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Health indicator for the worker pool.
 *
 * <ul>
 *   <li>UP: enabled and accepting work</li>
 *   <li>DEGRADED: a spawn failed recently and no worker is live</li>
 *   <li>DOWN: shutting down</li>
 *   <li>DISABLED: process isolation switched off by configuration</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class WorkerPoolHealthIndicator implements HealthIndicator {

    /** A spawn failure older than this no longer degrades health. */
    static final Duration SPAWN_FAILURE_WINDOW = Duration.ofMinutes(5);

    private final PoolSupervisor supervisor;
    private final Clock clock;

    @Autowired
    public WorkerPoolHealthIndicator(PoolSupervisor supervisor) {
        this(supervisor, Clock.systemUTC());
    }

    WorkerPoolHealthIndicator(PoolSupervisor supervisor, Clock clock) {
        this.supervisor = supervisor;
        this.clock = clock;
    }

    @Override
    public Health health() {
        PoolSnapshot snapshot = supervisor.snapshot();
        if (!snapshot.enabled()) {
            return Health.status("DISABLED")
                    .withDetail("status", "Process isolation disabled by configuration")
                    .build();
        }

        Health.Builder builder;
        if (snapshot.shuttingDown()) {
            builder = Health.down().withDetail("status", "Pool shutting down");
        } else if (recentSpawnFailure(snapshot) && snapshot.liveWorkers() == 0) {
            builder = Health.status("DEGRADED").withDetail("status", "Worker processes failing to start");
        } else {
            builder = Health.up().withDetail("status", "Accepting work");
        }
        return builder
                .withDetail("maxWorkers", snapshot.maxWorkers())
                .withDetail("liveWorkers", snapshot.liveWorkers())
                .withDetail("idleWorkers", snapshot.idleWorkers())
                .withDetail("busyWorkers", snapshot.busyWorkers())
                .withDetail("queueDepth", snapshot.queueDepth())
                .withDetail("timeouts", snapshot.timeouts())
                .withDetail("crashes", snapshot.crashes())
                .withDetail("spawnFailures", snapshot.spawnFailures())
                .build();
    }

    private boolean recentSpawnFailure(PoolSnapshot snapshot) {
        Instant last = snapshot.lastSpawnFailureAt();
        return last != null && last.isAfter(Instant.now(clock).minus(SPAWN_FAILURE_WINDOW));
    }
}
