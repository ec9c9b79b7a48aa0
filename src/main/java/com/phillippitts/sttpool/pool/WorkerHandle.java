package com.phillippitts.sttpool.pool;

import com.phillippitts.sttpool.domain.Outcome;
import com.phillippitts.sttpool.exception.WorkerProtocolException;
import com.phillippitts.sttpool.protocol.WorkerMessage;
import com.phillippitts.sttpool.protocol.WorkerProtocol;
import com.phillippitts.sttpool.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Supervisor-side record of one worker generation: the OS process, its two channel endpoints and
 * the bookkeeping the pool needs to assign, recycle and reap it.
 *
 * <p>Lifecycle fields ({@code status}, counters, timestamps) are guarded by the
 * {@link PoolSupervisor} lock. The in-flight call is published through a volatile field so the
 * reader thread can complete it without that lock.
 */
final class WorkerHandle {

    private static final Logger LOG = LogManager.getLogger(WorkerHandle.class);

    /** One dispatched unit awaiting its outcome. */
    record Call(String workId, CompletableFuture<Outcome> future) {
    }

    private final int slot;
    private final int generation;
    private final Process process;
    private final Writer inbound;
    private final BufferedReader outbound;
    private final Instant spawnedAt;

    // @GuardedBy("PoolSupervisor.lock")
    private WorkerStatus status = WorkerStatus.SPAWNING;
    private RecycleReason retireReason;
    private long pid = -1;
    private int tasksCompleted;
    private Instant lastActiveAt;

    private volatile Call call;
    private Thread stderrDrain;

    WorkerHandle(int slot, int generation, Process process, Instant spawnedAt) {
        this.slot = slot;
        this.generation = generation;
        this.process = Objects.requireNonNull(process, "process");
        this.inbound = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.outbound = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        this.spawnedAt = spawnedAt;
        this.lastActiveAt = spawnedAt;
    }

    /**
     * Starts the channel reader and the stderr drain.
     *
     * @param onReady invoked with the reported pid when the worker announces readiness
     * @param onExit  invoked once, from the reader thread, after the outbound channel closes
     */
    void start(BiConsumer<WorkerHandle, Long> onReady, Consumer<WorkerHandle> onExit) {
        WorkerLogDrain drain = new WorkerLogDrain(process.getErrorStream(), slot);
        stderrDrain = daemon(drain, drain.name());
        daemon(() -> readLoop(onReady, onExit), "worker-" + slot + "-reader");
    }

    private static Thread daemon(Runnable task, String name) {
        Thread thread = new Thread(task, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void readLoop(BiConsumer<WorkerHandle, Long> onReady, Consumer<WorkerHandle> onExit) {
        try {
            String line;
            while ((line = outbound.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                WorkerMessage message;
                try {
                    message = WorkerProtocol.decode(line);
                } catch (WorkerProtocolException e) {
                    LOG.warn("Worker {} sent an undecodable line: {}", id(), e.getMessage());
                    continue;
                }
                switch (message.type()) {
                    case READY -> onReady.accept(this, message.pid());
                    case OUTCOME -> deliver(message.outcome());
                    default -> LOG.warn("Worker {} sent unexpected {} message", id(), message.type());
                }
            }
        } catch (IOException e) {
            LOG.debug("Channel of worker {} closed: {}", id(), e.toString());
        } finally {
            onExit.accept(this);
        }
    }

    private void deliver(Outcome outcome) {
        Call current = call;
        if (current == null || !current.workId().equals(outcome.workId()) || !current.future().complete(outcome)) {
            LOG.debug("Discarding late outcome for unit {} from worker {}", outcome.workId(), id());
        }
    }

    /**
     * Registers the unit this worker is about to execute.
     */
    CompletableFuture<Outcome> beginCall(String workId) {
        Call next = new Call(workId, new CompletableFuture<>());
        this.call = next;
        return next.future();
    }

    /**
     * Completes the in-flight call with a supervisor-decided outcome.
     *
     * @return false if the call had already been resolved (or there is none)
     */
    boolean resolveCall(Function<String, Outcome> outcomeForWorkId) {
        Call current = call;
        return current != null && current.future().complete(outcomeForWorkId.apply(current.workId()));
    }

    Call currentCall() {
        return call;
    }

    void finishCall(Instant now) {
        call = null;
        tasksCompleted++;
        lastActiveAt = now;
    }

    void abandonCall() {
        call = null;
    }

    void markReady(long reportedPid, Instant now) {
        this.pid = reportedPid;
        this.status = WorkerStatus.IDLE;
        this.lastActiveAt = now;
    }

    void retire(RecycleReason reason) {
        this.status = WorkerStatus.RETIRING;
        this.retireReason = reason;
    }

    /**
     * Writes one message to the worker's stdin.
     */
    synchronized void send(WorkerMessage message) throws IOException {
        inbound.write(WorkerProtocol.encode(message));
        inbound.write('\n');
        inbound.flush();
    }

    /**
     * Sends {@code shutdown} and closes stdin. Either alone makes a healthy worker exit.
     */
    synchronized void requestShutdown() {
        try {
            send(WorkerMessage.shutdown());
        } catch (IOException e) {
            LOG.debug("Could not send shutdown to worker {}: {}", id(), e.getMessage());
        }
        try {
            inbound.close();
        } catch (IOException e) {
            LOG.debug("Could not close stdin of worker {}: {}", id(), e.getMessage());
        }
    }

    /**
     * Kills the process without waiting.
     */
    void kill() {
        if (process.isAlive()) {
            process.destroyForcibly();
        }
    }

    /**
     * Waits up to {@code millis} for the process to exit.
     *
     * @return true if the process has exited
     */
    boolean awaitExit(long millis) {
        try {
            return process.waitFor(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }

    /**
     * Exit code once the process has gone, or -1 if it is still running after a short wait.
     */
    int exitCode() {
        if (!awaitExit(ProcessTimeouts.EXIT_CODE_WAIT.toMillis())) {
            return -1;
        }
        try {
            return process.exitValue();
        } catch (IllegalThreadStateException e) {
            return -1;
        }
    }

    void joinStderrDrain() {
        Thread drain = stderrDrain;
        if (drain == null) {
            return;
        }
        try {
            drain.join(ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void markDead() {
        this.status = WorkerStatus.DEAD;
        this.call = null;
    }

    WorkerSnapshot snapshot() {
        return new WorkerSnapshot(slot, generation, pid, status, tasksCompleted, spawnedAt, lastActiveAt,
                ProcessMemory.UNKNOWN);
    }

    String id() {
        return slot + "#" + generation;
    }

    int slot() {
        return slot;
    }

    long pid() {
        return pid;
    }

    WorkerStatus status() {
        return status;
    }

    void status(WorkerStatus status) {
        this.status = status;
    }

    RecycleReason retireReason() {
        return retireReason;
    }

    int tasksCompleted() {
        return tasksCompleted;
    }

    Instant lastActiveAt() {
        return lastActiveAt;
    }

    Instant spawnedAt() {
        return spawnedAt;
    }
}
