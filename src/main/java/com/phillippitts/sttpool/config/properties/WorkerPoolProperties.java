package com.phillippitts.sttpool.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the isolated worker-process pool.
 *
 * <p>Example application.properties:
 * <pre>
 * stt.pool.enabled=true
 * stt.pool.max-workers=4
 * stt.pool.max-tasks-per-worker=100
 * stt.pool.idle-timeout-seconds=300
 * stt.pool.call-timeout-seconds=300
 * stt.pool.worker.work-function=vosk
 * stt.pool.worker.jvm-args=-Xmx512m,-XX:+UseSerialGC
 * </pre>
 */
@ConfigurationProperties(prefix = "stt.pool")
@Validated
public class WorkerPoolProperties {

    /** Feature toggle. When false no worker is ever spawned and every submission returns DISABLED. */
    private boolean enabled = true;

    /** Upper bound on live (spawning, idle, busy or retiring) workers. */
    @Positive(message = "Max workers must be positive")
    private int maxWorkers = 4;

    /** Floor the idle reaper never shrinks the pool below. Also the number of workers warmed at start. */
    @Min(value = 0, message = "Min workers must not be negative")
    private int minWorkers = 0;

    /** A worker is retired after completing this many units. */
    @Positive(message = "Max tasks per worker must be positive")
    private int maxTasksPerWorker = 100;

    /** Idle workers unused for longer than this are terminated by the reaper. */
    @Positive(message = "Idle timeout must be positive")
    private int idleTimeoutSeconds = 300;

    /** Interval between idle-reaper runs. */
    @Positive(message = "Reap interval must be positive")
    private long reapIntervalMs = 10_000;

    /** Default per-call deadline. Exceeding it kills and replaces the worker. */
    @Positive(message = "Call timeout must be positive")
    private int callTimeoutSeconds = 300;

    /** Longest a submission waits in the pending queue for a free worker. */
    @Positive(message = "Queue wait timeout must be positive")
    private long queueWaitTimeoutMs = 30_000;

    /** Bound of the pending queue; submissions beyond it resolve to QUEUE_TIMEOUT immediately. */
    @Positive(message = "Queue capacity must be positive")
    private int queueCapacity = 100;

    /** A spawned worker must report ready within this time or it is killed. */
    @Positive(message = "Startup timeout must be positive")
    private long startupTimeoutMs = 30_000;

    /** Grace period for workers to exit after a shutdown message before they are force-killed. */
    @Positive(message = "Shutdown grace must be positive")
    private long shutdownGraceMs = 10_000;

    @Valid
    @NotNull
    private Worker worker = new Worker();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public int getMinWorkers() {
        return minWorkers;
    }

    public void setMinWorkers(int minWorkers) {
        this.minWorkers = minWorkers;
    }

    public int getMaxTasksPerWorker() {
        return maxTasksPerWorker;
    }

    public void setMaxTasksPerWorker(int maxTasksPerWorker) {
        this.maxTasksPerWorker = maxTasksPerWorker;
    }

    public int getIdleTimeoutSeconds() {
        return idleTimeoutSeconds;
    }

    public void setIdleTimeoutSeconds(int idleTimeoutSeconds) {
        this.idleTimeoutSeconds = idleTimeoutSeconds;
    }

    public long getReapIntervalMs() {
        return reapIntervalMs;
    }

    public void setReapIntervalMs(long reapIntervalMs) {
        this.reapIntervalMs = reapIntervalMs;
    }

    public int getCallTimeoutSeconds() {
        return callTimeoutSeconds;
    }

    public void setCallTimeoutSeconds(int callTimeoutSeconds) {
        this.callTimeoutSeconds = callTimeoutSeconds;
    }

    public long getQueueWaitTimeoutMs() {
        return queueWaitTimeoutMs;
    }

    public void setQueueWaitTimeoutMs(long queueWaitTimeoutMs) {
        this.queueWaitTimeoutMs = queueWaitTimeoutMs;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public long getStartupTimeoutMs() {
        return startupTimeoutMs;
    }

    public void setStartupTimeoutMs(long startupTimeoutMs) {
        this.startupTimeoutMs = startupTimeoutMs;
    }

    public long getShutdownGraceMs() {
        return shutdownGraceMs;
    }

    public void setShutdownGraceMs(long shutdownGraceMs) {
        this.shutdownGraceMs = shutdownGraceMs;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Duration idleTimeout() {
        return Duration.ofSeconds(idleTimeoutSeconds);
    }

    public Duration callTimeout() {
        return Duration.ofSeconds(callTimeoutSeconds);
    }

    /**
     * How worker processes are launched.
     */
    public static class Worker {

        /** echo, vosk, or the fully-qualified name of a WorkFunction implementation. */
        @NotBlank(message = "Work function must not be blank")
        private String workFunction = "vosk";

        /** Java launcher; blank means the running JVM's bin/java. */
        private String javaBinary = "";

        /** Worker classpath; blank means the coordinator's java.class.path. */
        private String classpath = "";

        /** Extra JVM arguments, e.g. -Xmx512m. */
        private List<String> jvmArgs = new ArrayList<>();

        /** Extra environment variables for the worker process. */
        private Map<String, String> environment = new LinkedHashMap<>();

        /** Working directory; blank means the coordinator's. */
        private String workingDirectory = "";

        public String getWorkFunction() {
            return workFunction;
        }

        public void setWorkFunction(String workFunction) {
            this.workFunction = workFunction;
        }

        public String getJavaBinary() {
            return javaBinary;
        }

        public void setJavaBinary(String javaBinary) {
            this.javaBinary = javaBinary;
        }

        public String getClasspath() {
            return classpath;
        }

        public void setClasspath(String classpath) {
            this.classpath = classpath;
        }

        public List<String> getJvmArgs() {
            return jvmArgs;
        }

        public void setJvmArgs(List<String> jvmArgs) {
            this.jvmArgs = jvmArgs;
        }

        public Map<String, String> getEnvironment() {
            return environment;
        }

        public void setEnvironment(Map<String, String> environment) {
            this.environment = environment;
        }

        public String getWorkingDirectory() {
            return workingDirectory;
        }

        public void setWorkingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
        }
    }
}
