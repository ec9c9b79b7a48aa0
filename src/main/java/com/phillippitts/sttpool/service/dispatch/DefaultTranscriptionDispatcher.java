package com.phillippitts.sttpool.service.dispatch;

import com.phillippitts.sttpool.domain.Outcome;
import com.phillippitts.sttpool.domain.WorkPayload;
import com.phillippitts.sttpool.domain.WorkUnit;
import com.phillippitts.sttpool.pool.PoolSnapshot;
import com.phillippitts.sttpool.pool.PoolSupervisor;
import com.phillippitts.sttpool.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Default {@link TranscriptionDispatcher}: stamps each payload with a fresh {@link WorkUnit} id
 * (optionally prefixed with a correlation hint),
 * tags the logging context with it, and delegates to the {@link PoolSupervisor}.
 */
public class DefaultTranscriptionDispatcher implements TranscriptionDispatcher {

    private static final Logger LOG = LogManager.getLogger(DefaultTranscriptionDispatcher.class);

    static final String MDC_WORK_ID = "workId";

    private final PoolSupervisor supervisor;
    private final Executor dispatchExecutor;

    public DefaultTranscriptionDispatcher(PoolSupervisor supervisor, Executor dispatchExecutor) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
    }

    @Override
    public Outcome submit(WorkPayload payload) {
        return run(WorkUnit.create(Objects.requireNonNull(payload, "payload")), null);
    }

    @Override
    public Outcome submit(WorkPayload payload, Duration callTimeout) {
        Objects.requireNonNull(callTimeout, "callTimeout");
        return run(WorkUnit.create(Objects.requireNonNull(payload, "payload")), callTimeout);
    }

    @Override
    public Outcome submit(WorkPayload payload, Duration callTimeout, String correlationHint) {
        WorkUnit unit = WorkUnit.create(Objects.requireNonNull(payload, "payload"), correlationHint);
        if (unit.correlationHint() != null) {
            LOG.debug("Unit {} correlated with {}", unit.shortId(), unit.correlationHint());
        }
        return run(unit, callTimeout);
    }

    @Override
    public CompletableFuture<Outcome> submitAsync(WorkPayload payload) {
        WorkUnit unit = WorkUnit.create(Objects.requireNonNull(payload, "payload"));
        try {
            return CompletableFuture.supplyAsync(() -> run(unit, null), dispatchExecutor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Dispatch executor rejected unit {}: {}", unit.shortId(), e.getMessage());
            return CompletableFuture.completedFuture(Outcome.shuttingDown(unit.id()));
        }
    }

    private Outcome run(WorkUnit unit, Duration callTimeout) {
        String previous = ThreadContext.get(MDC_WORK_ID);
        ThreadContext.put(MDC_WORK_ID, unit.shortId());
        long start = System.nanoTime();
        try {
            Outcome outcome = callTimeout == null ? supervisor.submit(unit) : supervisor.submit(unit, callTimeout);
            long elapsedMs = TimeUtils.elapsedMillis(start);
            switch (outcome.kind()) {
                case SUCCESS -> LOG.info("Unit completed in {} ms", elapsedMs);
                case FAILURE -> LOG.info("Unit failed in {} ms: failureKind={}, errorType={}",
                        elapsedMs, outcome.failureKind(), outcome.errorType());
                case DISABLED -> LOG.debug("Unit not run: {}", outcome.message());
                default -> LOG.warn("Unit resolved to {} after {} ms: {}", outcome.kind(), elapsedMs, outcome.message());
            }
            return outcome;
        } finally {
            if (previous != null) {
                ThreadContext.put(MDC_WORK_ID, previous);
            } else {
                ThreadContext.remove(MDC_WORK_ID);
            }
        }
    }

    @Override
    public PoolSnapshot snapshot() {
        return supervisor.snapshot();
    }

    @Override
    public void shutdown() {
        supervisor.shutdown();
    }
}
