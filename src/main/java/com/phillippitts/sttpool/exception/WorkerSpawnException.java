package com.phillippitts.sttpool.exception;

/**
 * Thrown by the pool supervisor when a worker process cannot be launched or its channels
 * cannot be set up (e.g. OS resource exhaustion, missing java binary).
 *
 * <p>Never escapes {@code submit}; the dispatching caller receives a {@code POOL_UNAVAILABLE} outcome.
 */
public class WorkerSpawnException extends SttPoolException {

    private final int slot;

    public WorkerSpawnException(int slot, String message, Throwable cause) {
        super("Failed to spawn worker in slot " + slot + ": " + message, cause);
        this.slot = slot;
    }

    public int getSlot() {
        return slot;
    }
}
