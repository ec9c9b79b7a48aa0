package com.phillippitts.sttpool.pool;

import java.util.Locale;

/**
 * Why a worker generation ended.
 */
public enum RecycleReason {
    MAX_TASKS,
    IDLE,
    TIMEOUT,
    CRASH,
    SHUTDOWN;

    /** Metric tag value. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
