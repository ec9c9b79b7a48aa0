package com.phillippitts.sttpool.pool;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the pool for metrics, health and the HTTP pool endpoint.
 *
 * <p>Counts are taken under the supervisor lock and are mutually consistent. Memory figures are
 * read from the OS just after and are {@link ProcessMemory#UNKNOWN} where procfs is unavailable.
 */
public record PoolSnapshot(
        boolean enabled,
        boolean shuttingDown,
        int maxWorkers,
        int liveWorkers,
        int spawningWorkers,
        int idleWorkers,
        int busyWorkers,
        int retiringWorkers,
        int queueDepth,
        long completedTasks,
        long timeouts,
        long crashes,
        long recycled,
        long reaped,
        long queueTimeouts,
        long spawnFailures,
        Instant lastSpawnFailureAt,
        List<WorkerSnapshot> workers,
        long coordinatorRssBytes
) {

    public PoolSnapshot {
        workers = workers == null ? List.of() : List.copyOf(workers);
    }

    /**
     * Snapshot of a pool that never spawns (feature toggle off).
     */
    public static PoolSnapshot disabled(int maxWorkers) {
        return new PoolSnapshot(false, false, maxWorkers, 0, 0, 0, 0, 0, 0,
                0, 0, 0, 0, 0, 0, 0, null, List.of(), ProcessMemory.UNKNOWN);
    }

    /**
     * Sum of worker resident set sizes, skipping workers whose size is unknown.
     */
    public long workersRssBytes() {
        long total = 0;
        for (WorkerSnapshot worker : workers) {
            if (worker.rssBytes() > 0) {
                total += worker.rssBytes();
            }
        }
        return total;
    }

    /**
     * Coordinator plus workers: the memory footprint of the whole process tree.
     */
    public long totalRssBytes() {
        return Math.max(0L, coordinatorRssBytes) + workersRssBytes();
    }
}
