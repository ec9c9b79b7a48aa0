package com.phillippitts.sttpool.service.dispatch;

import com.phillippitts.sttpool.domain.Outcome;
import com.phillippitts.sttpool.domain.OutcomeKind;
import com.phillippitts.sttpool.domain.TranscriptionResult;
import com.phillippitts.sttpool.domain.WorkPayload;
import com.phillippitts.sttpool.domain.WorkUnit;
import com.phillippitts.sttpool.pool.PoolSupervisor;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultTranscriptionDispatcherTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(8);
    private PoolSupervisor supervisor;
    private DefaultTranscriptionDispatcher dispatcher;
    private final Set<String> workIdsSeenInMdc = ConcurrentHashMap.newKeySet();

    @BeforeEach
    void setUp() {
        ThreadContext.clearAll();
        supervisor = mock(PoolSupervisor.class);
        when(supervisor.submit(any(WorkUnit.class))).thenAnswer(invocation -> {
            WorkUnit unit = invocation.getArgument(0);
            workIdsSeenInMdc.add(ThreadContext.get(DefaultTranscriptionDispatcher.MDC_WORK_ID));
            return Outcome.success(unit.id(), TranscriptionResult.of(unit.payload().audioPath(), "en", 0.9, 5));
        });
        dispatcher = new DefaultTranscriptionDispatcher(supervisor, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        ThreadContext.clearAll();
    }

    @Test
    void concurrentSubmissionsGetUniqueIds() throws Exception {
        List<CompletableFuture<Outcome>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            futures.add(dispatcher.submitAsync(WorkPayload.of("clip-" + i + ".wav")));
        }

        Set<String> ids = ConcurrentHashMap.newKeySet();
        for (CompletableFuture<Outcome> future : futures) {
            Outcome outcome = future.get(5, TimeUnit.SECONDS);
            assertThat(outcome.kind()).isEqualTo(OutcomeKind.SUCCESS);
            ids.add(outcome.workId());
        }

        assertThat(ids).hasSize(50);
        assertThat(workIdsSeenInMdc).hasSize(50).doesNotContainNull();
    }

    @Test
    void tagsLoggingContextOnlyForTheCall() {
        ThreadContext.put(DefaultTranscriptionDispatcher.MDC_WORK_ID, "outer");

        Outcome outcome = dispatcher.submit(WorkPayload.of("clip.wav", "en"));

        assertThat(workIdsSeenInMdc).containsExactly(outcome.workId().substring(0, 8));
        assertThat(ThreadContext.get(DefaultTranscriptionDispatcher.MDC_WORK_ID)).isEqualTo("outer");
    }

    @Test
    void forwardsExplicitCallTimeout() {
        Duration timeout = Duration.ofSeconds(3);
        when(supervisor.submit(any(WorkUnit.class), eq(timeout)))
                .thenAnswer(invocation -> Outcome.timeout(((WorkUnit) invocation.getArgument(0)).id(), "slow"));

        Outcome outcome = dispatcher.submit(WorkPayload.of("clip.wav"), timeout);

        assertThat(outcome.kind()).isEqualTo(OutcomeKind.TIMEOUT);
        verify(supervisor).submit(any(WorkUnit.class), eq(timeout));
    }

    @Test
    void correlationHintTravelsInUnitIdWithDefaultTimeout() {
        Outcome outcome = dispatcher.submit(WorkPayload.of("clip.wav"), null, "req-42");

        assertThat(outcome.kind()).isEqualTo(OutcomeKind.SUCCESS);
        assertThat(outcome.workId()).startsWith("req-42/");
        assertThat(workIdsSeenInMdc).containsExactly(outcome.workId().substring(7, 15));
        verify(supervisor).submit(any(WorkUnit.class));
    }

    @Test
    void rejectedAsyncSubmissionResolvesToShuttingDown() throws Exception {
        DefaultTranscriptionDispatcher rejecting = new DefaultTranscriptionDispatcher(supervisor, task -> {
            throw new RejectedExecutionException("executor shut down");
        });

        Outcome outcome = rejecting.submitAsync(WorkPayload.of("clip.wav")).get(1, TimeUnit.SECONDS);

        assertThat(outcome.kind()).isEqualTo(OutcomeKind.SHUTTING_DOWN);
    }

    @Test
    void shutdownDelegatesToSupervisor() {
        dispatcher.shutdown();

        verify(supervisor).shutdown();
    }
}
