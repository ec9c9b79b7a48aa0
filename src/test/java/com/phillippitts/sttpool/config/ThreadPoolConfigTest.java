package com.phillippitts.sttpool.config;

import com.phillippitts.sttpool.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorFromDefaults() {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).dispatchExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(4);
            assertThat(executor.getMaxPoolSize()).isEqualTo(16);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("dispatch-");
            assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldRunConcurrentTasksOnNamedThreads() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).dispatchExecutor();
        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger onPoolThreads = new AtomicInteger();
        try {
            for (int i = 0; i < taskCount; i++) {
                executor.execute(() -> {
                    if (Thread.currentThread().getName().startsWith("dispatch-")) {
                        onPoolThreads.incrementAndGet();
                    }
                    latch.countDown();
                });
            }

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(onPoolThreads.get()).isEqualTo(taskCount);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldPropagateMdcAndRestoreWorkerThreadContext() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).dispatchExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> leftover = new AtomicReference<>("unset");
        CountDownLatch first = new CountDownLatch(1);
        CountDownLatch second = new CountDownLatch(1);
        try {
            ThreadContext.put("requestId", "req-42");
            executor.execute(() -> {
                seen.set(ThreadContext.get("requestId"));
                first.countDown();
            });
            assertThat(first.await(5, TimeUnit.SECONDS)).isTrue();

            ThreadContext.clearAll();
            executor.execute(() -> {
                leftover.set(ThreadContext.get("requestId"));
                second.countDown();
            });
            assertThat(second.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(seen.get()).isEqualTo("req-42");
            assertThat(leftover.get()).isNull();
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldShutdownGracefully() {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).dispatchExecutor();
        executor.execute(() -> { });

        executor.shutdown();

        assertThat(executor.getThreadPoolExecutor().isShutdown()).isTrue();
    }
}
