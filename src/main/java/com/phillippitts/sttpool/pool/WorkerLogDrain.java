package com.phillippitts.sttpool.pool;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Drains a worker's stderr and re-logs each line at DEBUG under {@code worker.<slot>}.
 *
 * <p>The stream must be drained continuously or a chatty worker blocks on a full pipe.
 */
final class WorkerLogDrain implements Runnable {

    /** Longer lines are cut before logging. */
    static final int MAX_LINE_CHARS = 8192;

    private final InputStream stream;
    private final Logger log;
    private final String name;

    WorkerLogDrain(InputStream stream, int slot) {
        this.stream = stream;
        this.log = LogManager.getLogger("worker." + slot);
        this.name = "worker-" + slot + "-stderr";
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                if (line.length() > MAX_LINE_CHARS) {
                    line = line.substring(0, MAX_LINE_CHARS) + "...";
                }
                log.debug(line);
            }
        } catch (IOException e) {
            log.debug("Stream '{}' stopped: {}", name, e.toString());
        }
    }

    String name() {
        return name;
    }
}
