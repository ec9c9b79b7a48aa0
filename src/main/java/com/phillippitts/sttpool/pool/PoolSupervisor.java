package com.phillippitts.sttpool.pool;

import com.phillippitts.sttpool.config.properties.WorkerPoolProperties;
import com.phillippitts.sttpool.domain.Outcome;
import com.phillippitts.sttpool.domain.OutcomeKind;
import com.phillippitts.sttpool.domain.WorkUnit;
import com.phillippitts.sttpool.exception.WorkerSpawnException;
import com.phillippitts.sttpool.protocol.WorkerMessage;
import com.phillippitts.sttpool.service.metrics.PoolMetricsPublisher;
import com.phillippitts.sttpool.util.ProcessTimeouts;
import com.phillippitts.sttpool.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the worker processes: refills every free slot up to {@code max-workers} on each submission,
 * assigns one unit at a time to an idle worker, enforces call deadlines, and retires workers after {@code max-tasks-per-worker}
 * completions, after a crash or timeout, or when the idle reaper finds them unused.
 *
 * <p>All pool state (the slot-to-handle map, the pending queue, cumulative counters) is guarded by a
 * single lock. Callers never block while holding it: they wait on a per-request assignment future
 * while queued and on a per-call outcome future while a worker runs their unit. Both waits are
 * timed; nothing polls.
 *
 * <p>{@link #submit(WorkUnit, Duration)} never throws for pool conditions; every path resolves to an
 * {@link Outcome}.
 *
 * <p>Lifecycle is explicit: the composition root calls {@link #start()} and {@link #shutdown()}.
 */
public class PoolSupervisor {

    private static final Logger LOG = LogManager.getLogger(PoolSupervisor.class);

    /** Result of waiting in the pending queue: a worker, or a terminal outcome. */
    private record Assignment(WorkerHandle handle, Outcome rejection) {
        static Assignment of(WorkerHandle handle) {
            return new Assignment(handle, null);
        }

        static Assignment rejected(Outcome outcome) {
            return new Assignment(null, outcome);
        }
    }

    private record PendingRequest(WorkUnit unit, CompletableFuture<Assignment> assignment) {
        PendingRequest(WorkUnit unit) {
            this(unit, new CompletableFuture<>());
        }
    }

    private final WorkerPoolProperties props;
    private final ProcessFactory processFactory;
    private final WorkerCommandBuilder commandBuilder;
    private final PoolMetricsPublisher metrics;
    private final ProcessMemory memory;
    private final ExecutorService terminator;

    private final ReentrantLock lock = new ReentrantLock();

    // @GuardedBy("lock")
    private final Map<Integer, WorkerHandle> handles = new TreeMap<>();
    private final Map<Integer, Integer> generations = new HashMap<>();
    private final Deque<PendingRequest> pending = new ArrayDeque<>();
    private boolean shuttingDown;
    private long completedTasks;
    private long timeouts;
    private long crashes;
    private long recycled;
    private long reaped;
    private long queueTimeouts;
    private long spawnFailures;
    private Instant lastSpawnFailureAt;

    public PoolSupervisor(WorkerPoolProperties props,
                          ProcessFactory processFactory,
                          WorkerCommandBuilder commandBuilder,
                          PoolMetricsPublisher metrics) {
        this(props, processFactory, commandBuilder, metrics, ProcessMemory.system());
    }

    public PoolSupervisor(WorkerPoolProperties props,
                          ProcessFactory processFactory,
                          WorkerCommandBuilder commandBuilder,
                          PoolMetricsPublisher metrics,
                          ProcessMemory memory) {
        this.props = Objects.requireNonNull(props, "props");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.commandBuilder = Objects.requireNonNull(commandBuilder, "commandBuilder");
        this.metrics = metrics != null ? metrics : PoolMetricsPublisher.NOOP;
        this.memory = Objects.requireNonNull(memory, "memory");
        AtomicInteger counter = new AtomicInteger();
        this.terminator = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "worker-terminator-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Warms {@code min-workers} workers. Spawn failures are logged; the next submission retries.
     */
    public void start() {
        if (!props.isEnabled()) {
            LOG.info("Worker pool disabled (stt.pool.enabled=false); no worker processes will be spawned");
            return;
        }
        int warm = Math.min(props.getMinWorkers(), props.getMaxWorkers());
        lock.lock();
        try {
            for (int slot = 0; slot < warm; slot++) {
                if (!handles.containsKey(slot)) {
                    trySpawnLocked(slot);
                }
            }
        } finally {
            lock.unlock();
        }
        LOG.info("Worker pool started: maxWorkers={}, minWorkers={}, maxTasksPerWorker={}, workFunction={}",
                props.getMaxWorkers(), props.getMinWorkers(), props.getMaxTasksPerWorker(),
                commandBuilder.workFunction());
    }

    /**
     * Runs a unit with the configured call timeout.
     */
    public Outcome submit(WorkUnit unit) {
        return submit(unit, props.callTimeout());
    }

    /**
     * Runs a unit on a worker and returns its outcome. Safe to call from many threads.
     *
     * @param unit        unit to execute
     * @param callTimeout deadline for the call once a worker has it (queue wait is bounded separately)
     * @return the single terminal outcome for {@code unit}
     */
    public Outcome submit(WorkUnit unit, Duration callTimeout) {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(callTimeout, "callTimeout");
        if (callTimeout.isZero() || callTimeout.isNegative()) {
            throw new IllegalArgumentException("callTimeout must be positive: " + callTimeout);
        }
        Outcome outcome = doSubmit(unit, callTimeout);
        metrics.recordOutcome(outcome.kind().name());
        return outcome;
    }

    private Outcome doSubmit(WorkUnit unit, Duration callTimeout) {
        if (!props.isEnabled()) {
            return Outcome.disabled(unit.id());
        }

        WorkerHandle handle;
        PendingRequest request = null;
        lock.lock();
        try {
            if (shuttingDown) {
                return Outcome.shuttingDown(unit.id());
            }
            try {
                ensureCapacityLocked();
            } catch (WorkerSpawnException e) {
                LOG.error("Cannot serve unit {}: {}", unit.shortId(), e.getMessage(), e);
                return Outcome.poolUnavailable(unit.id(), "Worker process could not be started");
            }
            handle = findIdleLocked();
            if (handle != null) {
                assignLocked(handle, unit);
            } else if (pending.size() >= props.getQueueCapacity()) {
                queueTimeouts++;
                LOG.warn("Pending queue full ({} units); rejecting unit {}", pending.size(), unit.shortId());
                return Outcome.queueTimeout(unit.id(), "Pending queue is full");
            } else {
                request = new PendingRequest(unit);
                pending.addLast(request);
                LOG.debug("Unit {} queued at position {}", unit.shortId(), pending.size());
            }
        } finally {
            lock.unlock();
        }

        if (request != null) {
            long queuedAt = System.nanoTime();
            Assignment assignment = awaitAssignment(request);
            metrics.recordQueueWait(System.nanoTime() - queuedAt);
            if (assignment.rejection() != null) {
                return assignment.rejection();
            }
            handle = assignment.handle();
        }
        return dispatch(handle, unit, callTimeout);
    }

    private Assignment awaitAssignment(PendingRequest request) {
        WorkUnit unit = request.unit();
        try {
            return request.assignment().get(props.getQueueWaitTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            lock.lock();
            try {
                if (pending.remove(request)) {
                    queueTimeouts++;
                    LOG.warn("Unit {} waited {} ms without a free worker", unit.shortId(),
                            props.getQueueWaitTimeoutMs());
                    return Assignment.rejected(Outcome.queueTimeout(unit.id(),
                            "No worker became available within " + props.getQueueWaitTimeoutMs() + " ms"));
                }
            } finally {
                lock.unlock();
            }
            // assigned between the timeout and taking the lock
            return request.assignment().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Outcome interrupted = Outcome.queueTimeout(unit.id(), "Interrupted while waiting for a worker");
            lock.lock();
            try {
                if (!pending.remove(request)) {
                    Assignment assignment = request.assignment().join();
                    if (assignment.handle() != null) {
                        returnUnusedLocked(assignment.handle());
                    }
                }
            } finally {
                lock.unlock();
            }
            return Assignment.rejected(interrupted);
        } catch (ExecutionException e) {
            return Assignment.rejected(Outcome.poolUnavailable(unit.id(), "Assignment failed: " + e.getCause()));
        }
    }

    private Outcome dispatch(WorkerHandle handle, WorkUnit unit, Duration callTimeout) {
        WorkerHandle.Call call = handle.currentCall();
        long started = System.nanoTime();
        try {
            handle.send(WorkerMessage.work(unit));
        } catch (IOException e) {
            // exit handling resolves the call once the process is gone
            LOG.warn("Could not send unit {} to worker {}: {}", unit.shortId(), handle.id(), e.getMessage());
            handle.kill();
        }

        Outcome outcome;
        try {
            outcome = call.future().get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            outcome = onCallTimeout(handle, call, unit, "No outcome within " + callTimeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = onCallTimeout(handle, call, unit, "Caller interrupted while awaiting outcome");
        } catch (ExecutionException e) {
            outcome = Outcome.workerCrashed(unit.id(), "Worker channel failed: " + e.getCause());
        }
        metrics.recordCallLatency(System.nanoTime() - started);

        if (outcome.kind() == OutcomeKind.SUCCESS || outcome.kind() == OutcomeKind.FAILURE) {
            release(handle);
        }
        return outcome;
    }

    private Outcome onCallTimeout(WorkerHandle handle, WorkerHandle.Call call, WorkUnit unit, String reason) {
        Outcome timeout = Outcome.timeout(unit.id(), reason + "; worker killed");
        lock.lock();
        try {
            if (!call.future().complete(timeout)) {
                // resolved concurrently by the worker or by exit handling
                return call.future().join();
            }
            timeouts++;
            LOG.warn("Unit {} timed out on worker {} (pid={}): {}", unit.shortId(), handle.id(), handle.pid(), reason);
            handle.kill();
            if (handles.get(handle.slot()) == handle) {
                removeLocked(handle, RecycleReason.TIMEOUT);
                respawnLocked(handle.slot());
            }
        } finally {
            lock.unlock();
        }
        return timeout;
    }

    private void release(WorkerHandle handle) {
        lock.lock();
        try {
            if (handles.get(handle.slot()) != handle || handle.status() != WorkerStatus.BUSY) {
                return;
            }
            handle.finishCall(Instant.now());
            completedTasks++;
            if (handle.tasksCompleted() >= props.getMaxTasksPerWorker()) {
                retireLocked(handle, RecycleReason.MAX_TASKS);
            } else {
                handle.status(WorkerStatus.IDLE);
                assignNextLocked(handle);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Terminates idle workers unused for longer than {@code idle-timeout-seconds}, never shrinking
     * below {@code min-workers}. Respawn is lazy: the next submission refills the pool.
     *
     * @return number of workers reaped
     */
    public int idleReap() {
        return idleReap(Instant.now());
    }

    int idleReap(Instant now) {
        if (!props.isEnabled()) {
            return 0;
        }
        Instant threshold = now.minus(props.idleTimeout());
        int reapedNow = 0;
        lock.lock();
        try {
            if (shuttingDown) {
                return 0;
            }
            int live = handles.size();
            for (WorkerHandle handle : new ArrayList<>(handles.values())) {
                if (live <= props.getMinWorkers()) {
                    break;
                }
                if (handle.status() == WorkerStatus.IDLE && handle.lastActiveAt().isBefore(threshold)) {
                    reaped++;
                    retireLocked(handle, RecycleReason.IDLE);
                    live--;
                    reapedNow++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (reapedNow > 0) {
            LOG.info("Idle reaper terminated {} worker(s) unused for more than {}s",
                    reapedNow, props.getIdleTimeoutSeconds());
        }
        return reapedNow;
    }

    /**
     * Stops the pool: pending submissions resolve to SHUTTING_DOWN, workers are asked to exit and
     * are force-killed after {@code shutdown-grace-ms}. Idempotent.
     */
    public void shutdown() {
        List<WorkerHandle> toStop;
        int drained = 0;
        lock.lock();
        try {
            if (shuttingDown) {
                return;
            }
            shuttingDown = true;
            PendingRequest request;
            while ((request = pending.pollFirst()) != null) {
                request.assignment().complete(Assignment.rejected(Outcome.shuttingDown(request.unit().id())));
                drained++;
            }
            toStop = new ArrayList<>(handles.values());
            for (WorkerHandle handle : toStop) {
                if (handle.status() != WorkerStatus.RETIRING) {
                    handle.retire(RecycleReason.SHUTDOWN);
                }
            }
        } finally {
            lock.unlock();
        }

        LOG.info("Shutting down worker pool: workers={}, drainedPending={}, graceMs={}",
                toStop.size(), drained, props.getShutdownGraceMs());
        for (WorkerHandle handle : toStop) {
            handle.requestShutdown();
        }
        long deadline = TimeUtils.deadlineAfter(Duration.ofMillis(props.getShutdownGraceMs()));
        for (WorkerHandle handle : toStop) {
            if (!handle.awaitExit(TimeUtils.remainingMillis(deadline))) {
                LOG.warn("Worker {} did not exit within grace period; killing", handle.id());
                handle.kill();
                if (!handle.awaitExit(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis())) {
                    LOG.warn("Worker {} still alive after destroyForcibly", handle.id());
                }
            }
        }
        terminator.shutdownNow();
        LOG.info("Worker pool stopped");
    }

    /**
     * Point-in-time view of the pool.
     */
    public PoolSnapshot snapshot() {
        if (!props.isEnabled()) {
            return PoolSnapshot.disabled(props.getMaxWorkers());
        }
        PoolSnapshot counts;
        lock.lock();
        try {
            List<WorkerSnapshot> workers = new ArrayList<>(handles.size());
            int spawning = 0;
            int idle = 0;
            int busy = 0;
            int retiring = 0;
            for (WorkerHandle handle : handles.values()) {
                workers.add(handle.snapshot());
                switch (handle.status()) {
                    case SPAWNING -> spawning++;
                    case IDLE -> idle++;
                    case BUSY -> busy++;
                    case RETIRING -> retiring++;
                    default -> {
                        // dead handles are removed from the map
                    }
                }
            }
            counts = new PoolSnapshot(true, shuttingDown, props.getMaxWorkers(), handles.size(),
                    spawning, idle, busy, retiring, pending.size(),
                    completedTasks, timeouts, crashes, recycled, reaped, queueTimeouts, spawnFailures,
                    lastSpawnFailureAt, workers, ProcessMemory.UNKNOWN);
        } finally {
            lock.unlock();
        }
        // procfs reads stay outside the lock
        List<WorkerSnapshot> measured = new ArrayList<>(counts.workers().size());
        for (WorkerSnapshot worker : counts.workers()) {
            measured.add(worker.withRssBytes(memory.residentBytes(worker.pid())));
        }
        return new PoolSnapshot(counts.enabled(), counts.shuttingDown(), counts.maxWorkers(), counts.liveWorkers(),
                counts.spawningWorkers(), counts.idleWorkers(), counts.busyWorkers(), counts.retiringWorkers(),
                counts.queueDepth(), counts.completedTasks(), counts.timeouts(), counts.crashes(), counts.recycled(),
                counts.reaped(), counts.queueTimeouts(), counts.spawnFailures(), counts.lastSpawnFailureAt(),
                measured, memory.coordinatorResidentBytes());
    }

    public boolean isEnabled() {
        return props.isEnabled();
    }

    // ---- worker callbacks (reader threads) ----

    private void onReady(WorkerHandle handle, long pid) {
        lock.lock();
        try {
            if (handles.get(handle.slot()) != handle || handle.status() != WorkerStatus.SPAWNING) {
                return;
            }
            handle.markReady(pid, Instant.now());
            LOG.info("Worker {} ready: pid={}, startupMs={}", handle.id(), pid,
                    Duration.between(handle.spawnedAt(), handle.lastActiveAt()).toMillis());
            if (!shuttingDown) {
                assignNextLocked(handle);
            }
        } finally {
            lock.unlock();
        }
    }

    private void onWorkerExit(WorkerHandle handle) {
        int exitCode = handle.exitCode();
        handle.joinStderrDrain();
        lock.lock();
        try {
            boolean current = handles.get(handle.slot()) == handle;
            WorkerStatus previous = handle.status();
            boolean resolved = handle.resolveCall(id -> shuttingDown
                    ? Outcome.shuttingDown(id)
                    : Outcome.workerCrashed(id, "Worker process exited with code " + exitCode + " mid-call"));
            if (!current) {
                handle.markDead();
                return;
            }
            switch (previous) {
                case SPAWNING -> {
                    removeLocked(handle, RecycleReason.CRASH);
                    spawnFailures++;
                    lastSpawnFailureAt = Instant.now();
                    metrics.recordSpawnFailure();
                    LOG.error("Worker {} exited with code {} before reporting ready", handle.id(), exitCode);
                    failPendingIfNoWorkersLocked();
                }
                case BUSY -> {
                    removeLocked(handle, RecycleReason.CRASH);
                    if (!shuttingDown) {
                        crashes++;
                        LOG.warn("Worker {} (pid={}) crashed with exit code {} after {} tasks{}", handle.id(),
                                handle.pid(), exitCode, handle.tasksCompleted(), resolved ? " mid-call" : "");
                        respawnLocked(handle.slot());
                    }
                }
                case IDLE -> {
                    removeLocked(handle, RecycleReason.CRASH);
                    if (!shuttingDown) {
                        crashes++;
                        LOG.warn("Idle worker {} (pid={}) exited unexpectedly with code {}",
                                handle.id(), handle.pid(), exitCode);
                    }
                }
                case RETIRING -> {
                    RecycleReason reason = handle.retireReason();
                    removeLocked(handle, null);
                    LOG.info("Worker {} exited after {} tasks (reason={}, exitCode={})",
                            handle.id(), handle.tasksCompleted(), reason, exitCode);
                    if (reason == RecycleReason.MAX_TASKS || !pending.isEmpty()) {
                        respawnLocked(handle.slot());
                    }
                }
                default -> handle.markDead();
            }
        } finally {
            lock.unlock();
        }
    }

    private void onStartupTimeout(WorkerHandle handle) {
        lock.lock();
        try {
            if (handles.get(handle.slot()) == handle && handle.status() == WorkerStatus.SPAWNING) {
                LOG.warn("Worker {} did not report ready within {} ms; killing", handle.id(),
                        props.getStartupTimeoutMs());
                handle.kill();
            }
        } finally {
            lock.unlock();
        }
    }

    // ---- helpers; caller holds the lock ----

    /**
     * Spawns a worker into every free slot below {@code max-workers}. Callers do not wait for the new
     * workers: they take an idle one or queue, and a fresh worker picks up the queue head once ready.
     * A failed launch stops the refill for this submission; the next submission tries again.
     *
     * @throws WorkerSpawnException if a launch fails and the pool has no worker at all
     */
    private void ensureCapacityLocked() {
        for (int slot = 0; slot < props.getMaxWorkers(); slot++) {
            if (handles.containsKey(slot)) {
                continue;
            }
            try {
                spawnLocked(slot);
            } catch (WorkerSpawnException e) {
                if (handles.isEmpty()) {
                    throw e;
                }
                LOG.error("Failed to refill slot {}; serving from {} existing worker(s): {}",
                        slot, handles.size(), e.getMessage(), e);
                return;
            }
        }
    }

    private WorkerHandle spawnLocked(int slot) {
        int generation = generations.merge(slot, 1, Integer::sum);
        List<String> command = commandBuilder.build(slot, generation);
        Process process;
        try {
            process = processFactory.start(command, commandBuilder.workingDirectory(), commandBuilder.environment());
        } catch (IOException | RuntimeException e) {
            spawnFailures++;
            lastSpawnFailureAt = Instant.now();
            metrics.recordSpawnFailure();
            throw new WorkerSpawnException(slot, e.getMessage(), e);
        }
        WorkerHandle handle = new WorkerHandle(slot, generation, process, Instant.now());
        handles.put(slot, handle);
        handle.start(this::onReady, this::onWorkerExit);
        CompletableFuture.delayedExecutor(props.getStartupTimeoutMs(), TimeUnit.MILLISECONDS)
                .execute(() -> onStartupTimeout(handle));
        LOG.info("Spawned worker {} (slot={}, generation={})", handle.id(), slot, generation);
        return handle;
    }

    private void trySpawnLocked(int slot) {
        try {
            spawnLocked(slot);
        } catch (WorkerSpawnException e) {
            LOG.error("Failed to spawn worker for slot {}: {}", slot, e.getMessage(), e);
        }
    }

    private void respawnLocked(int slot) {
        if (shuttingDown || handles.containsKey(slot)) {
            return;
        }
        trySpawnLocked(slot);
        if (!handles.containsKey(slot)) {
            failPendingIfNoWorkersLocked();
        }
    }

    private WorkerHandle findIdleLocked() {
        for (WorkerHandle handle : handles.values()) {
            if (handle.status() == WorkerStatus.IDLE) {
                return handle;
            }
        }
        return null;
    }

    private void assignLocked(WorkerHandle handle, WorkUnit unit) {
        handle.status(WorkerStatus.BUSY);
        handle.beginCall(unit.id());
    }

    private void assignNextLocked(WorkerHandle handle) {
        PendingRequest next;
        while ((next = pending.pollFirst()) != null) {
            assignLocked(handle, next.unit());
            if (next.assignment().complete(Assignment.of(handle))) {
                return;
            }
            handle.status(WorkerStatus.IDLE);
            handle.abandonCall();
        }
    }

    private void returnUnusedLocked(WorkerHandle handle) {
        if (handles.get(handle.slot()) != handle || handle.status() != WorkerStatus.BUSY) {
            return;
        }
        handle.abandonCall();
        handle.status(WorkerStatus.IDLE);
        assignNextLocked(handle);
    }

    private void retireLocked(WorkerHandle handle, RecycleReason reason) {
        handle.retire(reason);
        if (reason == RecycleReason.MAX_TASKS) {
            recycled++;
        }
        metrics.recordRecycled(reason.tag());
        LOG.info("Retiring worker {} after {} tasks (reason={})", handle.id(), handle.tasksCompleted(), reason);
        terminator.execute(() -> terminate(handle));
    }

    private void terminate(WorkerHandle handle) {
        handle.requestShutdown();
        if (!handle.awaitExit(props.getShutdownGraceMs())) {
            LOG.warn("Retiring worker {} did not exit within {} ms; killing", handle.id(), props.getShutdownGraceMs());
            handle.kill();
        }
    }

    /**
     * Drops a handle from the pool.
     *
     * @param reason recorded as a recycle metric when not null
     */
    private void removeLocked(WorkerHandle handle, RecycleReason reason) {
        handles.remove(handle.slot());
        handle.markDead();
        if (reason != null) {
            metrics.recordRecycled(reason.tag());
        }
        metrics.recordGenerationEnd(handle.tasksCompleted());
    }

    private void failPendingIfNoWorkersLocked() {
        if (!handles.isEmpty() || pending.isEmpty()) {
            return;
        }
        LOG.error("No live workers remain; failing {} pending unit(s)", pending.size());
        PendingRequest request;
        while ((request = pending.pollFirst()) != null) {
            request.assignment().complete(Assignment.rejected(
                    Outcome.poolUnavailable(request.unit().id(), "No worker process could be started")));
        }
    }
}
