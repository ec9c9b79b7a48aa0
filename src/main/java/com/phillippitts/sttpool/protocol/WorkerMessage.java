package com.phillippitts.sttpool.protocol;

import com.phillippitts.sttpool.domain.Outcome;
import com.phillippitts.sttpool.domain.WorkUnit;

import java.util.Objects;

/**
 * One message on a worker channel.
 *
 * <p>{@link Type#WORK} and {@link Type#SHUTDOWN} flow supervisor to worker (stdin);
 * {@link Type#READY} and {@link Type#OUTCOME} flow worker to supervisor (stdout).
 *
 * @param type           message type
 * @param work           unit to execute (WORK only)
 * @param outcome        classified result (OUTCOME only)
 * @param pid            OS process id of the worker (READY only, otherwise -1)
 * @param tasksCompleted worker-local completed counter after this outcome (OUTCOME only)
 */
public record WorkerMessage(Type type, WorkUnit work, Outcome outcome, long pid, int tasksCompleted) {

    public enum Type { WORK, SHUTDOWN, READY, OUTCOME }

    public WorkerMessage {
        Objects.requireNonNull(type, "type");
        if (type == Type.WORK) {
            Objects.requireNonNull(work, "WORK message requires a unit");
        }
        if (type == Type.OUTCOME) {
            Objects.requireNonNull(outcome, "OUTCOME message requires an outcome");
        }
    }

    public static WorkerMessage work(WorkUnit unit) {
        return new WorkerMessage(Type.WORK, unit, null, -1, 0);
    }

    public static WorkerMessage shutdown() {
        return new WorkerMessage(Type.SHUTDOWN, null, null, -1, 0);
    }

    public static WorkerMessage ready(long pid) {
        return new WorkerMessage(Type.READY, null, null, pid, 0);
    }

    public static WorkerMessage outcome(Outcome outcome, int tasksCompleted) {
        return new WorkerMessage(Type.OUTCOME, null, outcome, -1, tasksCompleted);
    }
}
