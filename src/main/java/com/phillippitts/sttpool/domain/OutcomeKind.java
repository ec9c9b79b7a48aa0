package com.phillippitts.sttpool.domain;

/**
 * Terminal result categories for a {@link WorkUnit}.
 */
public enum OutcomeKind {

    /** Work function returned a result. */
    SUCCESS,

    /** Work function ran and raised a domain error; the worker survived. */
    FAILURE,

    /** The call exceeded its deadline; the worker was killed and replaced. */
    TIMEOUT,

    /** The worker process exited or its channel closed mid-call. */
    WORKER_CRASHED,

    /** No worker became free within the queue-wait timeout, or the pending queue was full. */
    QUEUE_TIMEOUT,

    /** Process isolation is switched off by configuration. */
    DISABLED,

    /** The pool is shutting down. */
    SHUTTING_DOWN,

    /** The supervisor could not spawn a worker for this attempt. */
    POOL_UNAVAILABLE;

    /**
     * Returns true for kinds that indict the system rather than the caller's input.
     */
    public boolean isSystemFault() {
        return this != SUCCESS && this != FAILURE;
    }
}
