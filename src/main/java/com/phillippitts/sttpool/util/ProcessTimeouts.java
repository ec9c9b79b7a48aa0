package com.phillippitts.sttpool.util;

import java.time.Duration;

/**
 * Standard timeout values for worker process and thread management.
 *
 * <p>Configurable deadlines (call timeout, startup timeout, shutdown grace) live in
 * {@link com.phillippitts.sttpool.config.properties.WorkerPoolProperties}; the values here are the
 * short fixed waits used while tearing a process down.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Wait after {@link Process#destroyForcibly()} for the OS to reap the process.
     *
     * <p>Processes that survive this are typically unkillable due to OS bugs.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for a stderr drain thread to flush the last lines of a dead worker (best-effort).
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Wait for an exit code once a worker's output channel has closed.
     */
    public static final Duration EXIT_CODE_WAIT = Duration.ofMillis(500);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
