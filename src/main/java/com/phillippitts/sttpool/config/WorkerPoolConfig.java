package com.phillippitts.sttpool.config;

import com.phillippitts.sttpool.config.properties.WorkerPoolProperties;
import com.phillippitts.sttpool.config.stt.VoskConfig;
import com.phillippitts.sttpool.pool.DefaultProcessFactory;
import com.phillippitts.sttpool.pool.PoolSupervisor;
import com.phillippitts.sttpool.pool.ProcessFactory;
import com.phillippitts.sttpool.pool.WorkerCommandBuilder;
import com.phillippitts.sttpool.service.dispatch.DefaultTranscriptionDispatcher;
import com.phillippitts.sttpool.service.dispatch.TranscriptionDispatcher;
import com.phillippitts.sttpool.service.metrics.PoolMetrics;
import com.phillippitts.sttpool.service.metrics.PoolMetricsPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Composition root for the worker pool.
 *
 * <p>The supervisor's lifecycle is bound to the context: {@code start()} warms {@code min-workers}
 * after construction and {@code shutdown()} drains and stops every worker on close.
 */
@Configuration
public class WorkerPoolConfig {

    @Bean
    @ConditionalOnMissingBean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    @Bean
    public WorkerCommandBuilder workerCommandBuilder(WorkerPoolProperties props, VoskConfig voskConfig) {
        return new WorkerCommandBuilder(props.getWorker(), voskConfig);
    }

    @Bean
    public PoolMetricsPublisher poolMetricsPublisher(ObjectProvider<MeterRegistry> registryProvider) {
        MeterRegistry registry = registryProvider.getIfAvailable();
        return registry == null ? PoolMetricsPublisher.NOOP : new PoolMetricsPublisher(new PoolMetrics(registry));
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public PoolSupervisor poolSupervisor(WorkerPoolProperties props,
                                         ProcessFactory processFactory,
                                         WorkerCommandBuilder commandBuilder,
                                         PoolMetricsPublisher metricsPublisher) {
        return new PoolSupervisor(props, processFactory, commandBuilder, metricsPublisher);
    }

    // shutdown is owned by the supervisor bean
    @Bean(destroyMethod = "")
    public TranscriptionDispatcher transcriptionDispatcher(PoolSupervisor supervisor,
                                                           @Qualifier("dispatchExecutor") Executor dispatchExecutor) {
        return new DefaultTranscriptionDispatcher(supervisor, dispatchExecutor);
    }
}
