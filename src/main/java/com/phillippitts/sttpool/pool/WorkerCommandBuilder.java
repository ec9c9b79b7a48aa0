package com.phillippitts.sttpool.pool;

import com.phillippitts.sttpool.config.properties.WorkerPoolProperties;
import com.phillippitts.sttpool.config.stt.VoskConfig;
import com.phillippitts.sttpool.worker.WorkerMain;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the command line for a worker process:
 * {@code <java> <jvm-args> <-D settings> -cp <classpath> com.phillippitts.sttpool.worker.WorkerMain <work-function>}.
 *
 * <p>When the coordinator runs from a repackaged (nested) jar, {@code java.class.path} does not
 * expose the application classes; set {@code stt.pool.worker.classpath} explicitly in that case.
 */
public class WorkerCommandBuilder {

    /** Log4j2 configuration resource used inside workers. */
    public static final String WORKER_LOG_CONFIG = "log4j2-worker.xml";

    public static final String PROP_SLOT = "sttpool.worker.slot";
    public static final String PROP_GENERATION = "sttpool.worker.generation";

    private final WorkerPoolProperties.Worker worker;
    private final VoskConfig voskConfig;

    public WorkerCommandBuilder(WorkerPoolProperties.Worker worker, VoskConfig voskConfig) {
        this.worker = Objects.requireNonNull(worker, "worker");
        this.voskConfig = Objects.requireNonNull(voskConfig, "voskConfig");
    }

    /**
     * Builds the command for one worker generation.
     *
     * @param slot       stable pool slot
     * @param generation spawn count for this slot, starting at 1
     */
    public List<String> build(int slot, int generation) {
        List<String> cmd = new ArrayList<>();
        cmd.add(javaBinary());
        cmd.addAll(worker.getJvmArgs());
        cmd.addAll(voskConfig.toSystemProperties());
        cmd.add("-Dlog4j2.configurationFile=" + WORKER_LOG_CONFIG);
        cmd.add("-D" + PROP_SLOT + "=" + slot);
        cmd.add("-D" + PROP_GENERATION + "=" + generation);
        cmd.add("-cp");
        cmd.add(classpath());
        cmd.add(WorkerMain.class.getName());
        cmd.add(worker.getWorkFunction());
        return cmd;
    }

    /**
     * Working directory for workers, or null to inherit the coordinator's.
     */
    public Path workingDirectory() {
        String dir = worker.getWorkingDirectory();
        return dir == null || dir.isBlank() ? null : Path.of(dir);
    }

    public Map<String, String> environment() {
        return worker.getEnvironment() == null ? Map.of() : Map.copyOf(worker.getEnvironment());
    }

    public String workFunction() {
        return worker.getWorkFunction();
    }

    String javaBinary() {
        String configured = worker.getJavaBinary();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return Path.of(System.getProperty("java.home"), "bin", "java").toString();
    }

    String classpath() {
        String configured = worker.getClasspath();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return System.getProperty("java.class.path");
    }
}
