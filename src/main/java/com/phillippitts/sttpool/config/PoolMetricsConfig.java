package com.phillippitts.sttpool.config;

import com.phillippitts.sttpool.pool.PoolSnapshot;
import com.phillippitts.sttpool.pool.PoolSupervisor;
import com.phillippitts.sttpool.pool.WorkerSnapshot;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Exposes pool-size gauges via Micrometer:
 * <ul>
 *   <li>sttpool.workers.live - spawning, idle, busy or retiring workers</li>
 *   <li>sttpool.workers.idle - workers waiting for a unit</li>
 *   <li>sttpool.workers.busy - workers running a unit</li>
 *   <li>sttpool.queue.depth - submissions waiting for a free worker</li>
 *   <li>sttpool.memory.rss{process=coordinator|workers} - resident memory of this JVM and of all workers</li>
 *   <li>sttpool.memory.rss.total - coordinator plus workers</li>
 *   <li>sttpool.worker.rss{slot} - resident memory of the worker currently in a slot (NaN when empty)</li>
 * </ul>
 *
 * <p>A flat coordinator series next to a sawtooth worker series is the expected shape: workers leak,
 * recycling drops them back.
 *
 * <p>Available at {@code GET /actuator/metrics/sttpool.workers.live} and as
 * {@code sttpool_workers_live} on /actuator/prometheus. Also logs a pool summary every 5 minutes.
 */
@Configuration
public class PoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(PoolMetricsConfig.class);

    private final ObjectProvider<PoolSupervisor> supervisorProvider;

    public PoolMetricsConfig(ObjectProvider<PoolSupervisor> supervisorProvider) {
        this.supervisorProvider = supervisorProvider;
    }

    @Bean
    public MeterBinder workerPoolMetrics() {
        return registry -> {
            PoolSupervisor supervisor = supervisorProvider.getObject();

            Gauge.builder("sttpool.workers.live", supervisor, s -> s.snapshot().liveWorkers())
                    .description("Live worker processes")
                    .register(registry);

            Gauge.builder("sttpool.workers.idle", supervisor, s -> s.snapshot().idleWorkers())
                    .description("Idle worker processes")
                    .register(registry);

            Gauge.builder("sttpool.workers.busy", supervisor, s -> s.snapshot().busyWorkers())
                    .description("Worker processes running a unit")
                    .register(registry);

            Gauge.builder("sttpool.queue.depth", supervisor, s -> s.snapshot().queueDepth())
                    .description("Submissions waiting for a free worker")
                    .register(registry);

            Gauge.builder("sttpool.memory.rss", supervisor, s -> bytesOrNaN(s.snapshot().coordinatorRssBytes()))
                    .description("Resident memory of the coordinator JVM")
                    .tag("process", "coordinator")
                    .baseUnit("bytes")
                    .register(registry);

            Gauge.builder("sttpool.memory.rss", supervisor, s -> s.snapshot().workersRssBytes())
                    .description("Resident memory of all worker processes")
                    .tag("process", "workers")
                    .baseUnit("bytes")
                    .register(registry);

            Gauge.builder("sttpool.memory.rss.total", supervisor, s -> s.snapshot().totalRssBytes())
                    .description("Resident memory of the coordinator and its workers")
                    .baseUnit("bytes")
                    .register(registry);

            int slots = supervisor.snapshot().maxWorkers();
            for (int slot = 0; slot < slots; slot++) {
                int current = slot;
                Gauge.builder("sttpool.worker.rss", supervisor, s -> workerRss(s.snapshot(), current))
                        .description("Resident memory of the worker in this slot")
                        .tag("slot", Integer.toString(slot))
                        .baseUnit("bytes")
                        .register(registry);
            }

            LOG.info("Worker pool metrics registered: sttpool.* available via /actuator/metrics");
        };
    }

    static double workerRss(PoolSnapshot snapshot, int slot) {
        for (WorkerSnapshot worker : snapshot.workers()) {
            if (worker.slot() == slot) {
                return bytesOrNaN(worker.rssBytes());
            }
        }
        return Double.NaN;
    }

    private static double bytesOrNaN(long bytes) {
        return bytes < 0 ? Double.NaN : bytes;
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logPoolHealth() {
        PoolSupervisor supervisor = supervisorProvider.getIfAvailable();
        if (supervisor == null || !supervisor.isEnabled()) {
            return;
        }
        PoolSnapshot s = supervisor.snapshot();
        LOG.info("Worker Pool Health: live={}/{}, idle={}, busy={}, queued={}, completed={}, timeouts={}, crashes={}, "
                        + "coordinatorRssMb={}, workersRssMb={}",
                s.liveWorkers(), s.maxWorkers(), s.idleWorkers(), s.busyWorkers(), s.queueDepth(),
                s.completedTasks(), s.timeouts(), s.crashes(),
                s.coordinatorRssBytes() / (1024 * 1024), s.workersRssBytes() / (1024 * 1024));
    }
}
