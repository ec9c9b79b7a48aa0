package com.phillippitts.sttpool.pool;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Abstraction over {@link ProcessBuilder} so the supervisor can be tested hermetically.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests may provide a stub implementation
 * that returns a fake {@link Process} with controlled stdin/stdout/stderr and exit behavior.
 */
public interface ProcessFactory {

    /**
     * Starts a new process.
     *
     * @param command     full command line, with the executable as the first element
     * @param workingDir  working directory for the process (may be null)
     * @param environment extra environment variables (may be empty)
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir, Map<String, String> environment) throws IOException;
}
