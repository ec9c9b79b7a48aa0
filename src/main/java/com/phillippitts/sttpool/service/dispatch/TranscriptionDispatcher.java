package com.phillippitts.sttpool.service.dispatch;

import com.phillippitts.sttpool.domain.Outcome;
import com.phillippitts.sttpool.domain.WorkPayload;
import com.phillippitts.sttpool.pool.PoolSnapshot;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for running transcription work in isolated worker processes.
 *
 * <p>Callers hand over a payload and get back exactly one {@link Outcome}; queueing, worker
 * selection, timeouts and recycling stay behind this interface. Pool conditions never surface as
 * exceptions.
 */
public interface TranscriptionDispatcher {

    /**
     * Runs a payload with the configured call timeout, blocking until its outcome.
     */
    Outcome submit(WorkPayload payload);

    /**
     * Runs a payload with an explicit call timeout, blocking until its outcome.
     */
    Outcome submit(WorkPayload payload, Duration callTimeout);

    /**
     * Runs a payload under a unit id prefixed with the caller's correlation hint, so worker and
     * supervisor log lines can be matched to the originating request.
     *
     * @param callTimeout     explicit call timeout, or null for the configured one
     * @param correlationHint e.g. the HTTP request id; null or unusable hints are ignored
     */
    Outcome submit(WorkPayload payload, Duration callTimeout, String correlationHint);

    /**
     * Runs a payload on the dispatch executor.
     *
     * @return a future that always completes normally with the outcome
     */
    CompletableFuture<Outcome> submitAsync(WorkPayload payload);

    /**
     * Read-only pool introspection.
     */
    PoolSnapshot snapshot();

    /**
     * Stops the pool. Waiting and later submissions resolve to SHUTTING_DOWN.
     */
    void shutdown();
}
