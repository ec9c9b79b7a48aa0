package com.phillippitts.sttpool.pool;

import com.phillippitts.sttpool.config.properties.WorkerPoolProperties;
import com.phillippitts.sttpool.worker.WorkFunction;
import com.phillippitts.sttpool.worker.WorkerLoop;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Shared test doubles for pool tests.
 * Workers run the real {@link WorkerLoop} on a thread behind a fake {@link Process}, so the
 * supervisor exercises its full protocol without spawning JVMs.
 */
final class PoolTestDoubles {

    /** Exit code reported for a forcibly destroyed fake worker. */
    static final int KILLED_EXIT_CODE = 137;

    private PoolTestDoubles() {}

    static WorkerPoolProperties properties(int maxWorkers) {
        WorkerPoolProperties props = new WorkerPoolProperties();
        props.setMaxWorkers(maxWorkers);
        props.setMinWorkers(0);
        props.setMaxTasksPerWorker(100);
        props.setCallTimeoutSeconds(10);
        props.setQueueWaitTimeoutMs(10_000);
        props.setStartupTimeoutMs(5_000);
        props.setShutdownGraceMs(1_000);
        props.getWorker().setWorkFunction("scripted");
        return props;
    }

    /**
     * ProcessFactory that starts in-process workers and remembers every one of them.
     */
    static final class InProcessWorkerFactory implements ProcessFactory {
        private final Supplier<WorkFunction> functions;
        private final List<InProcessWorker> started = new CopyOnWriteArrayList<>();
        private final List<List<String>> commands = new CopyOnWriteArrayList<>();
        private final AtomicInteger pids = new AtomicInteger(1000);

        InProcessWorkerFactory(Supplier<WorkFunction> functions) {
            this.functions = functions;
        }

        @Override
        public Process start(List<String> command, Path workingDir, Map<String, String> environment) {
            commands.add(List.copyOf(command));
            InProcessWorker worker = new InProcessWorker(functions.get(), pids.incrementAndGet());
            started.add(worker);
            return worker;
        }

        int spawnCount() {
            return started.size();
        }

        long aliveCount() {
            return started.stream().filter(Process::isAlive).count();
        }

        List<InProcessWorker> started() {
            return started;
        }

        List<List<String>> commands() {
            return commands;
        }
    }

    /**
     * ProcessFactory whose launches always fail, as with a missing java binary.
     */
    static final class FailingProcessFactory implements ProcessFactory {
        private final AtomicInteger attempts = new AtomicInteger();

        @Override
        public Process start(List<String> command, Path workingDir, Map<String, String> environment)
                throws IOException {
            attempts.incrementAndGet();
            throw new IOException("Cannot run program \"" + command.get(0) + "\": error=2, No such file or directory");
        }

        int attempts() {
            return attempts.get();
        }
    }

    /**
     * Fake Process running a {@link WorkerLoop} on a daemon thread, wired through in-memory pipes.
     */
    static final class InProcessWorker extends Process {
        private final Pipe stdin = new Pipe();
        private final Pipe stdout = new Pipe();
        private final Pipe stderr = new Pipe();
        private final CountDownLatch exited = new CountDownLatch(1);
        private final Thread thread;
        private final long pid;
        private volatile int exitCode = -1;
        private volatile boolean destroyed;

        InProcessWorker(WorkFunction function, long pid) {
            this.pid = pid;
            this.thread = new Thread(() -> {
                int code = WorkerLoop.EXIT_FATAL;
                try {
                    code = new WorkerLoop(function,
                            new BufferedReader(new InputStreamReader(stdin.input(), StandardCharsets.UTF_8)),
                            new OutputStreamWriter(stdout.output(), StandardCharsets.UTF_8),
                            pid).run();
                } finally {
                    terminate(code);
                }
            }, "in-process-worker-" + pid);
            thread.setDaemon(true);
            thread.start();
        }

        private synchronized void terminate(int code) {
            if (exited.getCount() == 0) {
                return;
            }
            exitCode = code;
            exited.countDown();
            stdout.close();
            stderr.close();
        }

        boolean wasDestroyed() {
            return destroyed;
        }

        @Override
        public OutputStream getOutputStream() {
            return stdin.output();
        }

        @Override
        public InputStream getInputStream() {
            return stdout.input();
        }

        @Override
        public InputStream getErrorStream() {
            return stderr.input();
        }

        @Override
        public int waitFor() throws InterruptedException {
            exited.await();
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            return exited.await(timeout, unit);
        }

        @Override
        public int exitValue() {
            if (exited.getCount() > 0) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyed = true;
            // close the channel before interrupting so an interrupted call cannot report back
            terminate(KILLED_EXIT_CODE);
            thread.interrupt();
        }

        @Override
        public Process destroyForcibly() {
            destroy();
            return this;
        }

        @Override
        public boolean isAlive() {
            return exited.getCount() > 0;
        }

        @Override
        public long pid() {
            return pid;
        }
    }

    /**
     * Unbounded in-memory byte pipe. Unlike PipedInputStream it does not care which threads write.
     */
    static final class Pipe {
        private static final byte[] EOF = new byte[0];

        private final BlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
        private volatile boolean closed;

        private final OutputStream output = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                write(new byte[] {(byte) b}, 0, 1);
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                if (closed) {
                    throw new IOException("Pipe closed");
                }
                if (len > 0) {
                    chunks.add(Arrays.copyOfRange(b, off, off + len));
                }
            }

            @Override
            public void close() {
                Pipe.this.close();
            }
        };

        private final InputStream input = new InputStream() {
            private byte[] current;
            private int pos;
            private boolean eof;

            @Override
            public int read() throws IOException {
                byte[] one = new byte[1];
                int n = read(one, 0, 1);
                return n < 0 ? -1 : one[0] & 0xff;
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                if (len == 0) {
                    return 0;
                }
                if (current == null || pos >= current.length) {
                    if (eof) {
                        return -1;
                    }
                    try {
                        current = chunks.take();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new InterruptedIOException("interrupted while reading pipe");
                    }
                    pos = 0;
                    if (current.length == 0) {
                        eof = true;
                        return -1;
                    }
                }
                int n = Math.min(len, current.length - pos);
                System.arraycopy(current, pos, b, off, n);
                pos += n;
                return n;
            }
        };

        synchronized void close() {
            if (!closed) {
                closed = true;
                chunks.add(EOF);
            }
        }

        OutputStream output() {
            return output;
        }

        InputStream input() {
            return input;
        }
    }
}
