package com.phillippitts.sttpool.pool;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads the resident set size of a process from {@code <procRoot>/<pid>/status} ({@code VmRSS}).
 *
 * <p>Worker memory is what the pool exists to bound, so it is read from the OS rather than from
 * the worker: a leaking native library is invisible to the worker's own heap accounting.
 * Returns {@link #UNKNOWN} on platforms without procfs and for processes that are already gone.
 */
public class ProcessMemory {

    private static final Logger LOG = LogManager.getLogger(ProcessMemory.class);

    public static final long UNKNOWN = -1L;

    private static final String RSS_KEY = "VmRSS:";

    private final Path procRoot;

    public ProcessMemory(Path procRoot) {
        this.procRoot = Objects.requireNonNull(procRoot, "procRoot");
    }

    /** Memory reader over the live {@code /proc} filesystem. */
    public static ProcessMemory system() {
        return new ProcessMemory(Path.of("/proc"));
    }

    /**
     * @param pid process id; non-positive ids (worker not ready yet) yield {@link #UNKNOWN}
     * @return resident set size in bytes, or {@link #UNKNOWN}
     */
    public long residentBytes(long pid) {
        if (pid <= 0) {
            return UNKNOWN;
        }
        Path status = procRoot.resolve(Long.toString(pid)).resolve("status");
        List<String> lines;
        try {
            lines = Files.readAllLines(status, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return UNKNOWN;
        } catch (IOException e) {
            LOG.debug("Cannot read {}: {}", status, e.getMessage());
            return UNKNOWN;
        }
        for (String line : lines) {
            if (line.startsWith(RSS_KEY)) {
                return parseKilobytes(line.substring(RSS_KEY.length()), status);
            }
        }
        return UNKNOWN;
    }

    /** Resident set size of this (coordinator) JVM. */
    public long coordinatorResidentBytes() {
        return residentBytes(ProcessHandle.current().pid());
    }

    // "   123456 kB"
    private static long parseKilobytes(String value, Path source) {
        String[] parts = value.trim().split("\\s+");
        try {
            return Long.parseLong(parts[0]) * 1024L;
        } catch (NumberFormatException e) {
            LOG.debug("Unparseable VmRSS in {}: '{}'", source, value.trim());
            return UNKNOWN;
        }
    }
}
