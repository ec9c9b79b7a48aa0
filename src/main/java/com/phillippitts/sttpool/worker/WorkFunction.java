package com.phillippitts.sttpool.worker;

import com.phillippitts.sttpool.domain.TranscriptionResult;
import com.phillippitts.sttpool.domain.WorkPayload;

/**
 * Pluggable unit of leaky, CPU/native-heavy work executed inside a worker process.
 *
 * <p>Lifecycle inside one worker generation:
 * <ol>
 *   <li>{@link #initialize()} runs once before the worker reports ready (e.g. native model load)</li>
 *   <li>{@link #execute(WorkPayload)} runs once per unit, strictly one at a time</li>
 *   <li>{@link #close()} runs when the worker shuts down cleanly</li>
 * </ol>
 *
 * <p>Implementations may leak: the process is discarded after a bounded number of calls. They must
 * not retain per-call state between calls. Anything written to {@code System.out} is redirected to
 * stderr by the worker and never reaches the supervisor channel.
 *
 * <p>Implementations loaded by class name need a public no-arg constructor.
 */
public interface WorkFunction extends AutoCloseable {

    /**
     * One-time initialization. An exception here keeps the worker from ever reporting ready.
     */
    default void initialize() throws Exception {
    }

    /**
     * Executes one unit of work.
     *
     * @param payload input reference for this call
     * @return the result to return to the caller
     * @throws Exception any work-level error; classified into a FAILURE outcome by the worker loop
     */
    TranscriptionResult execute(WorkPayload payload) throws Exception;

    /**
     * Short name used in logs (e.g. "vosk", "echo").
     */
    String name();

    @Override
    default void close() {
    }
}
