package com.phillippitts.sttpool.pool;

import java.time.Instant;

/**
 * Point-in-time view of one worker generation.
 *
 * @param slot           stable pool slot (the worker id)
 * @param generation     spawn count for this slot
 * @param pid            OS process id reported by the worker, or -1 before it is ready
 * @param status         lifecycle status
 * @param tasksCompleted units completed by this generation
 * @param spawnedAt      when this generation was started
 * @param lastActiveAt   last completion, or readiness if none yet
 * @param rssBytes       resident set size of the worker process, or {@link ProcessMemory#UNKNOWN}
 */
public record WorkerSnapshot(
        int slot,
        int generation,
        long pid,
        WorkerStatus status,
        int tasksCompleted,
        Instant spawnedAt,
        Instant lastActiveAt,
        long rssBytes
) {

    WorkerSnapshot withRssBytes(long rssBytes) {
        return new WorkerSnapshot(slot, generation, pid, status, tasksCompleted, spawnedAt, lastActiveAt, rssBytes);
    }
}
