package com.phillippitts.sttpool.domain;

/**
 * Classification of a work-level failure raised inside a worker process.
 */
public enum FailureKind {

    /** Bad input: missing file, unsupported or malformed audio, invalid parameters. */
    INVALID_INPUT,

    /** The speech engine itself failed (native error, model problem). */
    ENGINE_ERROR,

    /** Anything else thrown by the work function. */
    UNEXPECTED
}
