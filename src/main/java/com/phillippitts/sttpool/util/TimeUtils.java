package com.phillippitts.sttpool.util;

import java.time.Duration;

/**
 * Monotonic-clock helpers over {@link System#nanoTime()} used for call latency and wait deadlines.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds since a {@link System#nanoTime()} reading, truncated.
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }

    /**
     * Returns a {@link System#nanoTime()} deadline {@code timeout} from now. Negative timeouts count as zero.
     */
    public static long deadlineAfter(Duration timeout) {
        long nanos = timeout.isNegative() ? 0L : timeout.toNanos();
        return System.nanoTime() + nanos;
    }

    /**
     * Milliseconds left until a deadline from {@link #deadlineAfter(Duration)}; zero once it has passed.
     */
    public static long remainingMillis(long deadlineNanos) {
        return Math.max(0L, nanosToMillis(deadlineNanos - System.nanoTime()));
    }
}
