package com.phillippitts.sttpool.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal, tagged result of a {@link WorkUnit}.
 *
 * <p>Exactly one variant is populated: {@link OutcomeKind#SUCCESS} carries a {@link #result()} and
 * nothing else; {@link OutcomeKind#FAILURE} carries {@link #failureKind()}, {@link #errorType()} and
 * {@link #message()}; every other kind carries only a {@link #message()}.
 *
 * @param workId      id of the unit this outcome resolves
 * @param kind        outcome variant
 * @param result      transcription result (SUCCESS only)
 * @param failureKind work-level failure classification (FAILURE only)
 * @param errorType   simple class name of the exception raised in the worker (FAILURE only)
 * @param message     human-readable detail (every kind except SUCCESS)
 * @param completedAt time the outcome was resolved
 */
public record Outcome(
        String workId,
        OutcomeKind kind,
        TranscriptionResult result,
        FailureKind failureKind,
        String errorType,
        String message,
        Instant completedAt
) {

    public Outcome {
        Objects.requireNonNull(workId, "workId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (completedAt == null) {
            completedAt = Instant.now();
        }
        if (kind == OutcomeKind.SUCCESS) {
            Objects.requireNonNull(result, "SUCCESS outcome requires a result");
            if (failureKind != null || errorType != null || message != null) {
                throw new IllegalArgumentException("SUCCESS outcome must not carry failure data");
            }
        } else {
            if (result != null) {
                throw new IllegalArgumentException(kind + " outcome must not carry a result");
            }
            if (kind == OutcomeKind.FAILURE) {
                Objects.requireNonNull(failureKind, "FAILURE outcome requires a failure kind");
            } else if (failureKind != null || errorType != null) {
                throw new IllegalArgumentException(kind + " outcome must not carry failure classification");
            }
        }
    }

    public static Outcome success(String workId, TranscriptionResult result) {
        return new Outcome(workId, OutcomeKind.SUCCESS, result, null, null, null, Instant.now());
    }

    public static Outcome failure(String workId, FailureKind failureKind, String errorType, String message) {
        return new Outcome(workId, OutcomeKind.FAILURE, null, failureKind, errorType, message, Instant.now());
    }

    public static Outcome timeout(String workId, String message) {
        return of(workId, OutcomeKind.TIMEOUT, message);
    }

    public static Outcome workerCrashed(String workId, String message) {
        return of(workId, OutcomeKind.WORKER_CRASHED, message);
    }

    public static Outcome queueTimeout(String workId, String message) {
        return of(workId, OutcomeKind.QUEUE_TIMEOUT, message);
    }

    public static Outcome disabled(String workId) {
        return of(workId, OutcomeKind.DISABLED, "Worker pool is disabled by configuration");
    }

    public static Outcome shuttingDown(String workId) {
        return of(workId, OutcomeKind.SHUTTING_DOWN, "Worker pool is shutting down");
    }

    public static Outcome poolUnavailable(String workId, String message) {
        return of(workId, OutcomeKind.POOL_UNAVAILABLE, message);
    }

    /**
     * Creates a non-success, non-failure outcome of the given kind.
     */
    public static Outcome of(String workId, OutcomeKind kind, String message) {
        if (kind == OutcomeKind.SUCCESS || kind == OutcomeKind.FAILURE) {
            throw new IllegalArgumentException("Use success()/failure() for " + kind);
        }
        return new Outcome(workId, kind, null, null, null, message, Instant.now());
    }

    public boolean isSuccess() {
        return kind == OutcomeKind.SUCCESS;
    }
}
