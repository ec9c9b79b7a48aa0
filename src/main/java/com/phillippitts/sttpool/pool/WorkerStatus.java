package com.phillippitts.sttpool.pool;

/**
 * Lifecycle of one worker generation:
 * {@code SPAWNING -> IDLE <-> BUSY -> RETIRING -> DEAD}.
 */
public enum WorkerStatus {

    /** Process started, {@code ready} not yet received. */
    SPAWNING,

    /** Ready and not assigned. */
    IDLE,

    /** Executing exactly one unit. */
    BUSY,

    /** Told to exit (recycled, reaped or shutting down); never assigned again. */
    RETIRING,

    /** Process exited and the handle left the pool. */
    DEAD;

    /**
     * True for statuses that occupy a slot in the pool.
     */
    public boolean isLive() {
        return this != DEAD;
    }
}
