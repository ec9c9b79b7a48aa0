package com.phillippitts.sttpool.worker;

import com.phillippitts.sttpool.domain.Outcome;
import com.phillippitts.sttpool.domain.TranscriptionResult;
import com.phillippitts.sttpool.domain.WorkUnit;
import com.phillippitts.sttpool.exception.WorkerProtocolException;
import com.phillippitts.sttpool.protocol.WorkerMessage;
import com.phillippitts.sttpool.protocol.WorkerProtocol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Request loop run by a worker process.
 *
 * <p>Initializes the work function, announces readiness, then executes one unit per inbound
 * {@code work} message until a {@code shutdown} message or end of input. Work-level exceptions are
 * classified and returned as FAILURE outcomes; the worker survives them. An {@link Error} ends the
 * loop with {@link #EXIT_FATAL}, which the supervisor observes as a crash.
 *
 * <p>Not thread-safe; exactly one loop per process.
 */
public final class WorkerLoop {

    private static final Logger LOG = LogManager.getLogger(WorkerLoop.class);

    /** Clean exit: shutdown requested or the supervisor closed the channel. */
    public static final int EXIT_OK = 0;
    /** An Error escaped the work function (EX_SOFTWARE). */
    public static final int EXIT_FATAL = 70;
    /** The work function could not be created or initialized (EX_CONFIG). */
    public static final int EXIT_INIT_FAILED = 78;

    private final WorkFunction function;
    private final BufferedReader in;
    private final Writer out;
    private final long pid;

    private int tasksCompleted;

    public WorkerLoop(WorkFunction function, BufferedReader in, Writer out, long pid) {
        this.function = Objects.requireNonNull(function, "function");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.pid = pid;
    }

    /**
     * Runs until shutdown, end of input, or a fatal error.
     *
     * @return the process exit code
     */
    public int run() {
        try {
            function.initialize();
        } catch (Exception | LinkageError e) {
            LOG.error("Work function '{}' failed to initialize; exiting", function.name(), e);
            return EXIT_INIT_FAILED;
        }

        try {
            send(WorkerMessage.ready(pid));
            LOG.info("Worker ready: pid={}, function={}", pid, function.name());
            return serve();
        } catch (IOException e) {
            LOG.warn("Channel to supervisor failed; exiting: {}", e.getMessage());
            return EXIT_OK;
        } catch (Error e) {
            LOG.fatal("Fatal error in worker pid={} after {} tasks", pid, tasksCompleted, e);
            return EXIT_FATAL;
        } finally {
            closeQuietly();
        }
    }

    private int serve() throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            WorkerMessage message;
            try {
                message = WorkerProtocol.decode(line);
            } catch (WorkerProtocolException e) {
                LOG.warn("Skipping malformed message: {}", e.getMessage());
                continue;
            }
            switch (message.type()) {
                case WORK -> send(WorkerMessage.outcome(execute(message.work()), tasksCompleted));
                case SHUTDOWN -> {
                    LOG.info("Shutdown requested after {} tasks", tasksCompleted);
                    return EXIT_OK;
                }
                default -> LOG.warn("Ignoring unexpected {} message", message.type());
            }
        }
        LOG.info("Input closed after {} tasks; exiting", tasksCompleted);
        return EXIT_OK;
    }

    private Outcome execute(WorkUnit unit) {
        ThreadContext.put("workId", unit.shortId());
        try {
            TranscriptionResult result = function.execute(unit.payload());
            if (result == null) {
                throw new IllegalStateException("Work function returned no result");
            }
            LOG.debug("Unit completed: chars={}", result.text().length());
            return Outcome.success(unit.id(), result);
        } catch (Exception e) {
            Outcome outcome = FailureClassifier.classify(unit.id(), e);
            LOG.warn("Unit failed: failureKind={}, errorType={}, message={}",
                    outcome.failureKind(), outcome.errorType(), outcome.message());
            return outcome;
        } finally {
            tasksCompleted++;
            ThreadContext.remove("workId");
        }
    }

    private void send(WorkerMessage message) throws IOException {
        out.write(WorkerProtocol.encode(message));
        out.write('\n');
        out.flush();
    }

    private void closeQuietly() {
        try {
            function.close();
        } catch (Exception e) {
            LOG.warn("Error closing work function '{}'", function.name(), e);
        }
    }

    int tasksCompleted() {
        return tasksCompleted;
    }
}
