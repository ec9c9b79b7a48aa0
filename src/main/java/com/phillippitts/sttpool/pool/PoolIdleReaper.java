package com.phillippitts.sttpool.pool;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Periodically returns memory to the OS by terminating workers idle past
 * {@code stt.pool.idle-timeout-seconds}.
 */
@Component
@ConditionalOnProperty(prefix = "stt.pool", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PoolIdleReaper {

    private static final Logger LOG = LogManager.getLogger(PoolIdleReaper.class);

    private final PoolSupervisor supervisor;

    public PoolIdleReaper(PoolSupervisor supervisor) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    }

    @Scheduled(fixedDelayString = "${stt.pool.reap-interval-ms:10000}",
            initialDelayString = "${stt.pool.reap-interval-ms:10000}")
    public void reap() {
        try {
            int reaped = supervisor.idleReap();
            if (reaped > 0) {
                LOG.debug("Reaper pass complete: reaped={}, pool={}", reaped, supervisor.snapshot().liveWorkers());
            }
        } catch (RuntimeException e) {
            LOG.error("Idle reaper pass failed", e);
        }
    }
}
