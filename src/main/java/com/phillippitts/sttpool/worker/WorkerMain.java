package com.phillippitts.sttpool.worker;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Entry point of a worker process.
 *
 * <p>Usage: {@code java [jvm-args] -cp <classpath> com.phillippitts.sttpool.worker.WorkerMain <work-function>}
 *
 * <p>stdin carries inbound messages and the original stdout carries outbound messages. Anything
 * else that writes to {@code System.out} (native libraries, stray prints) is redirected to stderr,
 * which the supervisor drains as log output.
 */
public final class WorkerMain {

    private WorkerMain() {
    }

    public static void main(String[] args) {
        PrintStream channel = System.out;
        System.setOut(System.err);
        Logger log = LogManager.getLogger(WorkerMain.class);

        String name = args.length > 0 ? args[0] : EchoWorkFunction.NAME;
        int exitCode;
        try {
            WorkFunction function = WorkFunctions.resolve(name);
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            BufferedWriter out = new BufferedWriter(new OutputStreamWriter(channel, StandardCharsets.UTF_8));
            exitCode = new WorkerLoop(function, in, out, ProcessHandle.current().pid()).run();
        } catch (IllegalArgumentException e) {
            log.error("Cannot start worker: {}", e.getMessage(), e);
            exitCode = WorkerLoop.EXIT_INIT_FAILED;
        }
        LogManager.shutdown();
        System.exit(exitCode);
    }
}
